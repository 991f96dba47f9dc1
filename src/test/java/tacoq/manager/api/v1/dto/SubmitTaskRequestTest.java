package tacoq.manager.api.v1.dto;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SubmitTaskRequestTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void inputDataIsKeptAsJsonText() throws Exception {
        SubmitTaskRequest req = mapper.readValue("""
                {"taskType":"render","inputData":{"scene":"castle","frames":[1,2,3]}}
                """, SubmitTaskRequest.class);

        assertDoesNotThrow(req::validate);
        assertEquals("render", req.taskType());
        assertEquals("{\"scene\":\"castle\",\"frames\":[1,2,3]}", req.inputJson());
    }

    @Test
    void missingOrNullInputIsNull() throws Exception {
        assertNull(mapper.readValue("{\"taskType\":\"render\"}", SubmitTaskRequest.class).inputJson());
        assertNull(mapper.readValue("{\"taskType\":\"render\",\"inputData\":null}", SubmitTaskRequest.class)
                .inputJson());
    }

    @Test
    void taskTypeIsRequired() throws Exception {
        SubmitTaskRequest req = mapper.readValue("{\"inputData\":1}", SubmitTaskRequest.class);

        assertThrows(IllegalArgumentException.class, req::validate);
    }
}
