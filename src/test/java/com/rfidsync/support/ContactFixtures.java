package com.rfidsync.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.rfidsync.domain.model.Contact;
import com.rfidsync.domain.model.ContactFieldMapping;
import com.rfidsync.domain.model.FieldValue;
import com.rfidsync.domain.model.MembershipLevelRef;

import java.util.ArrayList;
import java.util.List;

/**
 * Contactos de prueba con la forma que devuelve el directorio.
 */
public final class ContactFixtures {

    public static final String TAG_FIELD = "TagId";
    public static final String TRAINING_FIELD = "SafetyTrainings";
    public static final ObjectMapper MAPPER = new ObjectMapper();

    private ContactFixtures() {
    }

    public static ContactFieldMapping mapping() {
        return ContactFieldMapping.builder()
                .tagIdField(TAG_FIELD)
                .trainingField(TRAINING_FIELD)
                .build();
    }

    /**
     * Contacto con tag en texto y capacitaciones como lista de {Id, Label}.
     */
    public static Contact contact(long id, String tag, int level, String... trainings) {
        List<FieldValue> fields = new ArrayList<>();
        fields.add(field("Email", JsonNodeFactory.instance.textNode("member" + id + "@example.org")));
        if (tag != null) {
            fields.add(field(TAG_FIELD, JsonNodeFactory.instance.textNode(tag)));
        }
        fields.add(field(TRAINING_FIELD, trainingList(trainings)));
        return Contact.builder()
                .id(id)
                .displayName("Member " + id)
                .membershipLevel(level > 0 ? new MembershipLevelRef(level, "Level " + level) : null)
                .fieldValues(fields)
                .build();
    }

    public static Contact contactWithFields(long id, FieldValue... fields) {
        return Contact.builder()
                .id(id)
                .fieldValues(new ArrayList<>(List.of(fields)))
                .build();
    }

    public static FieldValue field(String name, JsonNode value) {
        return FieldValue.builder().fieldName(name).value(value).build();
    }

    public static ArrayNode trainingList(String... labels) {
        ArrayNode array = JsonNodeFactory.instance.arrayNode();
        int id = 1;
        for (String label : labels) {
            array.addObject().put("Id", id++).put("Label", label);
        }
        return array;
    }

    public static JsonNode json(String raw) {
        try {
            return MAPPER.readTree(raw);
        } catch (Exception e) {
            throw new IllegalArgumentException(raw, e);
        }
    }
}
