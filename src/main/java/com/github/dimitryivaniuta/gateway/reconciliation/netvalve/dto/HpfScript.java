package com.github.dimitryivaniuta.gateway.reconciliation.netvalve.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Hosted-fields script as listed by the backoffice API.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HpfScript(
        Long id,
        String netvalveScriptSrc,
        String integrity,
        String clientVersion,
        String status,
        Boolean deleted,
        @JsonProperty("isDefault") Boolean isDefault,
        String createdDate
) {

    /**
     * @return true for an ACTIVE, not deleted script served over https
     */
    public boolean isUsable() {
        return "ACTIVE".equals(status)
                && !Boolean.TRUE.equals(deleted)
                && netvalveScriptSrc != null
                && netvalveScriptSrc.startsWith("https://");
    }

    public boolean isDefaultScript() {
        return Boolean.TRUE.equals(isDefault);
    }
}
