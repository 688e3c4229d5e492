package com.github.dimitryivaniuta.gateway.reconciliation.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

/**
 * Jackson configuration.
 *
 * <p>JSON is the default wire format. An additional {@link XmlMapper} reads the OrderGroove
 * order-placement documents; it is exposed under its own type so it never replaces the JSON mapper
 * used by Spring MVC.</p>
 */
@Configuration
public class JacksonConfig {

    /**
     * JSON mapper shared by controllers, gateway clients and the outbox.
     *
     * @param builder Boot-configured builder
     * @return json mapper
     */
    @Bean
    @Primary
    public ObjectMapper objectMapper(Jackson2ObjectMapperBuilder builder) {
        ObjectMapper om = builder.createXmlMapper(false).build();
        om.registerModule(new JavaTimeModule());
        return om;
    }

    /**
     * XML mapper for inbound subscription orders.
     *
     * @param builder Boot-configured builder
     * @return xml mapper
     */
    @Bean
    public XmlMapper orderXmlMapper(Jackson2ObjectMapperBuilder builder) {
        XmlMapper xml = builder.createXmlMapper(true).build();
        xml.registerModule(new JavaTimeModule());
        return xml;
    }

    @Bean
    Jackson2ObjectMapperBuilderCustomizer javaTimeModule() {
        return builder -> builder.modules(new JavaTimeModule());
    }
}
