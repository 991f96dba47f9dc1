package tacoq.manager.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * JSON encoding of transport messages.
 */
public final class MessageCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .findAndRegisterModules()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private MessageCodec() {
    }

    public static byte[] encode(Object message) {
        try {
            return MAPPER.writeValueAsBytes(message);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode " + message.getClass().getSimpleName(), e);
        }
    }

    public static DispatchMessage decodeDispatch(byte[] body) throws IOException {
        return MAPPER.readValue(body, DispatchMessage.class);
    }

    public static ResultMessage decodeResult(byte[] body) throws IOException {
        return MAPPER.readValue(body, ResultMessage.class);
    }
}
