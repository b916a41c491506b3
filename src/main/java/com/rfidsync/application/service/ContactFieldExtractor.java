package com.rfidsync.application.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.rfidsync.domain.exception.ExtractionException;
import com.rfidsync.domain.model.Contact;
import com.rfidsync.domain.model.ContactData;
import com.rfidsync.domain.model.ContactFieldMapping;
import com.rfidsync.domain.model.FieldValue;
import com.rfidsync.domain.model.FieldValueKind;
import com.rfidsync.domain.model.TrainingLink;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Extrae el tag RFID y las capacitaciones de los campos de un contacto.
 * Cada valor se valida según su forma real; nunca se convierte implícitamente.
 */
@Component
public class ContactFieldExtractor {

    private static final String LABEL_KEY = "Label";
    private static final Pattern ASCII_INTEGER = Pattern.compile("[+-]?[0-9]+");

    /**
     * Obtiene el tag del contacto.
     *
     * @return el tag positivo, o 0 si el campo no existe o está vacío
     * @throws ExtractionException si el valor no es texto, no es numérico o no es positivo
     */
    public long extractTagId(Contact contact, ContactFieldMapping mapping) {
        Optional<FieldValue> field = contact.findField(mapping.getTagIdField());
        if (field.isEmpty()) {
            return 0L;
        }

        FieldValue value = field.get();
        return switch (value.kind()) {
            case ABSENT -> 0L;
            case STRING -> parseTagId(value.getValue().asText());
            case LIST, OTHER -> throw ExtractionException.tagIdNotString(mapping.getTagIdField());
        };
    }

    /**
     * Obtiene las etiquetas de capacitación en el orden del directorio.
     * Si un elemento es inválido se descarta la lista completa.
     *
     * @return lista de etiquetas, vacía si el campo no existe
     * @throws ExtractionException si el valor no es una lista de registros con Label
     */
    public List<String> extractTrainingLabels(Contact contact, ContactFieldMapping mapping) {
        Optional<FieldValue> field = contact.findField(mapping.getTrainingField());
        if (field.isEmpty() || field.get().kind() == FieldValueKind.ABSENT) {
            return Collections.emptyList();
        }

        FieldValue value = field.get();
        if (value.kind() != FieldValueKind.LIST) {
            throw ExtractionException.trainingNotList(mapping.getTrainingField());
        }

        List<String> labels = new ArrayList<>();
        int index = 0;
        for (JsonNode item : value.getValue()) {
            JsonNode label = item.isObject() ? item.get(LABEL_KEY) : null;
            if (label == null || !label.isTextual()) {
                throw ExtractionException.trainingItemInvalid(index);
            }
            if (label.asText().length() > TrainingLink.MAX_TRAINING_NAME_LENGTH) {
                throw ExtractionException.trainingLabelTooLong(index, TrainingLink.MAX_TRAINING_NAME_LENGTH);
            }
            labels.add(label.asText());
            index++;
        }
        return labels;
    }

    /**
     * Combina la extracción del tag y de las capacitaciones.
     * Un error en el tag se propaga; un error en las capacitaciones se reporta junto al tag.
     *
     * @throws ExtractionException si el tag es inválido
     */
    public ContactData extractContactData(Contact contact, ContactFieldMapping mapping) {
        long tagId;
        try {
            tagId = extractTagId(contact, mapping);
        } catch (ExtractionException e) {
            throw ExtractionException.forContact(contact.getId(), e);
        }

        List<String> labels = Collections.emptyList();
        ExtractionException trainingError = null;
        try {
            labels = extractTrainingLabels(contact, mapping);
        } catch (ExtractionException e) {
            trainingError = ExtractionException.forContact(contact.getId(), e);
        }

        return ContactData.builder()
                .contactId(contact.getId())
                .tagId(tagId)
                .membershipLevel(contact.membershipLevelId())
                .trainingLabels(labels)
                .trainingError(trainingError)
                .build();
    }

    private long parseTagId(String raw) {
        if (raw.isEmpty()) {
            return 0L;
        }

        // Integer.parseInt acepta dígitos Unicode; el tag solo admite 0-9
        if (!ASCII_INTEGER.matcher(raw).matches()) {
            throw ExtractionException.tagIdNotNumeric(raw, null);
        }

        int parsed;
        try {
            parsed = Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw ExtractionException.tagIdNotNumeric(raw, e);
        }

        if (parsed <= 0) {
            throw ExtractionException.nonPositiveTagId(parsed);
        }
        return parsed;
    }
}
