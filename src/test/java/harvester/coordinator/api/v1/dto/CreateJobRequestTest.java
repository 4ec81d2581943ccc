package harvester.coordinator.api.v1.dto;

import com.fasterxml.jackson.databind.ObjectMapper;
import harvester.coordinator.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CreateJobRequestTest {

    @Test
    void parsesAndAppliesDefaults() throws Exception {
        CreateJobRequest request = new ObjectMapper().readValue(
                "{\"owner\":\"ana\",\"targets\":[\"a\",\"b\"],\"maxRetries\":0}", CreateJobRequest.class);

        request.validate();
        assertTrue(request.hasInlineTargets());
        assertEquals(10_000, request.batchSizeOr(10_000));
        assertEquals(0, request.maxRetriesOr(2));
    }

    @Test
    void requiresExactlyOneInput() {
        assertThrows(ValidationException.class,
                () -> new CreateJobRequest(null, null, null, null, null, null).validate());
        assertThrows(ValidationException.class,
                () -> new CreateJobRequest(null, List.of("a"), "/tmp/in.txt", null, null, null).validate());
        assertThrows(ValidationException.class,
                () -> new CreateJobRequest(null, List.of(), null, null, null, null).validate());
        new CreateJobRequest(null, null, "/tmp/in.txt", null, null, null).validate();
    }

    @Test
    void rejectsNullTargets() throws Exception {
        CreateJobRequest request = new ObjectMapper().readValue(
                "{\"targets\":[\"a\",null,\"b\",\"c\"]}", CreateJobRequest.class);

        ValidationException e = assertThrows(ValidationException.class, request::validate);
        assertTrue(e.getMessage().contains("null"));
    }

    @Test
    void rejectsOutOfRangeParameters() {
        assertThrows(ValidationException.class,
                () -> new CreateJobRequest(null, List.of("a"), null, 0, null, null).validate());
        assertThrows(ValidationException.class,
                () -> new CreateJobRequest(null, List.of("a"), null, null, -1, null).validate());
        assertThrows(ValidationException.class,
                () -> new CreateJobRequest(null, List.of("a"), null, null, null, "ftp://hooks.local").validate());
    }
}
