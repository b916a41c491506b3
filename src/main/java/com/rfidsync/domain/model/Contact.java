package com.rfidsync.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Contacto tal como lo entrega el endpoint /contacts del directorio.
 * Es transitorio: nunca se persiste tal cual.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Contact {

    @JsonProperty("Id")
    private long id;

    @JsonProperty("FirstName")
    private String firstName;

    @JsonProperty("LastName")
    private String lastName;

    @JsonProperty("Email")
    private String email;

    @JsonProperty("DisplayName")
    private String displayName;

    @JsonProperty("Status")
    private String status;

    @JsonProperty("MembershipLevel")
    private MembershipLevelRef membershipLevel;

    @JsonProperty("FieldValues")
    @Builder.Default
    private List<FieldValue> fieldValues = new ArrayList<>();

    /**
     * Busca el primer campo con el nombre indicado.
     *
     * @param fieldName nombre del campo en el directorio
     * @return Optional con el campo si existe
     */
    public Optional<FieldValue> findField(String fieldName) {
        if (fieldValues == null || fieldName == null) {
            return Optional.empty();
        }
        return fieldValues.stream()
                .filter(f -> fieldName.equals(f.getFieldName()))
                .findFirst();
    }

    /**
     * Nivel de membresía del contacto, 0 si no tiene.
     */
    public int membershipLevelId() {
        return membershipLevel != null ? membershipLevel.getId() : 0;
    }
}
