package tacoq.manager.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class MessageCodecTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void dispatchMessageUsesCamelCaseFields() throws Exception {
        UUID task = UUID.randomUUID();
        UUID worker = UUID.randomUUID();
        byte[] body = MessageCodec.encode(new DispatchMessage(task, "render", worker, "{\"frame\":7}"));

        JsonNode json = MAPPER.readTree(body);
        assertEquals(task.toString(), json.get("taskId").asText());
        assertEquals("render", json.get("taskType").asText());
        assertEquals(worker.toString(), json.get("workerId").asText());
        // payload travels as an opaque string
        assertTrue(json.get("inputData").isTextual());
        assertEquals("{\"frame\":7}", json.get("inputData").asText());
    }

    @Test
    void resultMessageFromWorkerIgnoresUnknownFields() throws Exception {
        UUID task = UUID.randomUUID();
        UUID worker = UUID.randomUUID();
        String json = """
                {"taskId":"%s","workerId":"%s","success":false,"errorData":"{\\"code\\":3}","attempt":2}
                """.formatted(task, worker);

        ResultMessage message = MessageCodec.decodeResult(json.getBytes(StandardCharsets.UTF_8));

        assertEquals(task, message.taskId());
        assertFalse(message.success());
        assertNull(message.outputData());
        assertEquals("{\"code\":3}", message.toReport().errorData());
    }

    @Test
    void garbageIsAnIoError() {
        assertThrows(IOException.class, () -> MessageCodec.decodeResult("{".getBytes(StandardCharsets.UTF_8)));
    }
}
