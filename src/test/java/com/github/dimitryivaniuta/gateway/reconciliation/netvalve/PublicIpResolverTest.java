package com.github.dimitryivaniuta.gateway.reconciliation.netvalve;

import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.github.dimitryivaniuta.gateway.reconciliation.config.AppProperties;
import java.time.Clock;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class PublicIpResolverTest {

    @Test
    void fallsThroughLookupsAndCachesResult() {
        RestTemplate rest = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(rest).build();
        PublicIpResolver resolver = new PublicIpResolver(
                NetValveHttpClients.sharing(rest), new NetValveEndpoints(new AppProperties()), Clock.systemUTC());

        server.expect(requestTo(PublicIpResolver.LOOKUP_URLS.get(0))).andRespond(withServerError());
        server.expect(requestTo(PublicIpResolver.LOOKUP_URLS.get(1)))
                .andRespond(withSuccess("<html>blocked</html>", MediaType.TEXT_HTML));
        server.expect(requestTo(PublicIpResolver.LOOKUP_URLS.get(2)))
                .andRespond(withSuccess("203.0.113.7\n", MediaType.TEXT_PLAIN));

        Assertions.assertEquals("203.0.113.7", resolver.resolve());
        Assertions.assertEquals("203.0.113.7", resolver.resolve());
        server.verify();
    }
}
