package com.e2eq.attribute.resource.dto;

import com.e2eq.attribute.model.AttributePatch;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UpdateAttributeRequestTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void testValuesOnlyConstraintsLeaveBoundsAlone() throws Exception {
        String body = "{\"constraints\":{\"enumValues\":[\"a\",\"b\",\"c\"]}}";

        AttributePatch patch = mapper.readValue(body, UpdateAttributeRequest.class).toPatch("bob");

        assertNull(patch.getConstraints());
        assertTrue(patch.carriesValues());
        assertEquals(3, patch.getEnumValues().size());
        assertEquals("bob", patch.getModifiedBy());
    }

    @Test
    void testBoundsAreCarriedWithValues() throws Exception {
        String body = "{\"revision\":4,\"constraints\":{\"maxLength\":12,\"enumValues\":[\"a\"]}}";

        AttributePatch patch = mapper.readValue(body, UpdateAttributeRequest.class).toPatch(null);

        assertEquals(Integer.valueOf(12), patch.getConstraints().getMaxLength());
        assertNull(patch.getConstraints().getMinLength());
        assertEquals(Long.valueOf(4), patch.getExpectedRevision());
        assertEquals(1, patch.getEnumValues().size());
    }

    @Test
    void testBulkBodyReadsIdsAndUpdates() throws Exception {
        String body = "{\"attributeIds\":[\"a1\",\"b2\"],\"updates\":{\"description\":\"Shared\",\"isRequired\":true}}";

        BulkUpdateRequest request = mapper.readValue(body, BulkUpdateRequest.class);
        AttributePatch patch = request.getUpdates().toPatch(null);

        assertEquals(List.of("a1", "b2"), request.getAttributeIds());
        assertEquals("Shared", patch.getDescription());
        assertEquals(Boolean.TRUE, patch.getRequired());
        assertNull(patch.getExpectedRevision());
    }
}
