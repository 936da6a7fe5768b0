package com.e2eq.attribute.resource.dto;

import com.e2eq.attribute.constraint.ValueFormat;
import com.e2eq.attribute.exceptions.AttributeValidationException;
import com.e2eq.attribute.model.AttributeCategory;
import com.e2eq.attribute.model.AttributeSpec;
import com.e2eq.attribute.value.DataType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CreateAttributeRequestTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void testReadsClientPayload() throws Exception {
        String body = "{\"name\":\"region\",\"displayName\":\"Region\",\"categories\":[\"subject\",\"resource\"],"
                + "\"dataType\":\"string\",\"isRequired\":true,\"permittedValues\":\"EU, US\","
                + "\"constraints\":{\"maxLength\":8,\"format\":\"email\"},\"tags\":[\"geo\"]}";

        AttributeSpec spec = mapper.readValue(body, CreateAttributeRequest.class).toSpec("alice");

        assertEquals("region", spec.getName());
        assertEquals(Set.of(AttributeCategory.SUBJECT, AttributeCategory.RESOURCE), spec.getCategories());
        assertEquals(DataType.STRING, spec.getDataType());
        assertTrue(spec.isRequired());
        assertEquals("EU, US", spec.getPermittedValues());
        assertEquals(Integer.valueOf(8), spec.getConstraints().getMaxLength());
        assertEquals(ValueFormat.EMAIL, spec.getConstraints().getFormat());
        assertEquals("alice", spec.getCreatedBy());
    }

    @Test
    void testEnumerationInsideConstraintsIsUsedWhenNoTopLevelList() throws Exception {
        String body = "{\"name\":\"level\",\"dataType\":\"number\",\"constraints\":{\"enumValues\":[1,2,3]}}";

        AttributeSpec spec = mapper.readValue(body, CreateAttributeRequest.class).toSpec(null);

        assertEquals(3, spec.getEnumValues().size());
        assertTrue(spec.getConstraints().getEnumValues().isEmpty());
    }

    @Test
    void testTopLevelListWins() throws Exception {
        String body = "{\"name\":\"level\",\"dataType\":\"number\",\"enumValues\":[7],"
                + "\"constraints\":{\"enumValues\":[1,2,3]}}";

        AttributeSpec spec = mapper.readValue(body, CreateAttributeRequest.class).toSpec(null);

        assertEquals(1, spec.getEnumValues().size());
        assertEquals(7, spec.getEnumValues().get(0).asInt());
    }

    @Test
    void testUnknownFormatIsAValidationError() {
        CreateAttributeRequest request = CreateAttributeRequest.builder()
                .name("contact")
                .dataType(DataType.STRING)
                .constraints(ConstraintsPayload.builder().format("fax").build())
                .build();

        assertThrows(AttributeValidationException.class, () -> request.toSpec(null));
    }
}
