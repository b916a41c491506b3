package com.rfidsync.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Par nombre-valor de un contacto del directorio.
 * El valor se conserva como JSON crudo hasta que el extractor lo valida.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FieldValue {

    @JsonProperty("FieldName")
    private String fieldName;

    @JsonProperty("Value")
    private JsonNode value;

    @JsonProperty("SystemCode")
    private String systemCode;

    public FieldValueKind kind() {
        return FieldValueKind.of(value);
    }
}
