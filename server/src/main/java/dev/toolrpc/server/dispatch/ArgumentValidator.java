package dev.toolrpc.server.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import dev.toolrpc.protocol.ToolDescriptor;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks tool arguments against the tool's input schema with the NetworkNT JSON Schema
 * validator. Compiled schemas are cached per descriptor; the registry never changes after startup.
 */
public class ArgumentValidator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ArgumentValidator.class);

    private final ObjectMapper mapper;
    private final JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    private final Map<ToolDescriptor, JsonSchema> schemas = new ConcurrentHashMap<>();

    public ArgumentValidator(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Validate arguments for one call.
     * @param tool descriptor of the called tool
     * @param arguments argument value supplied by the caller
     * @return one message per violation, empty when the arguments are acceptable
     */
    public List<String> validate(ToolDescriptor tool, JsonNode arguments) {
        JsonSchema schema = schemas.computeIfAbsent(tool, this::compile);
        Set<ValidationMessage> messages = schema.validate(arguments);
        if (!messages.isEmpty()) {
            LOGGER.debug("Arguments for {} rejected: {}", tool.name(), messages);
        }
        return messages.stream().map(ValidationMessage::getMessage).toList();
    }

    private JsonSchema compile(ToolDescriptor tool) {
        JsonNode schemaNode = mapper.valueToTree(tool.inputSchema());
        return factory.getSchema(schemaNode);
    }
}
