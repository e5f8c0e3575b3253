package dev.toolrpc.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of {@code tools/call}. A result carrying an error item is still a protocol success: the
 * call was dispatched, but the tool itself failed.
 * @param content ordered content items
 */
@JsonIgnoreProperties(value = { "isError" }, allowGetters = true, ignoreUnknown = true)
public record InvocationResult(List<ContentItem> content) {

    public InvocationResult {
        content = content == null ? List.of() : List.copyOf(content);
    }

    public static InvocationResult text(String... texts) {
        return new InvocationResult(Arrays.stream(texts).map(ContentItem::text).toList());
    }

    public static InvocationResult error(String message) {
        return new InvocationResult(List.of(ContentItem.error(message)));
    }

    @JsonProperty("isError")
    public boolean isError() {
        return content.stream().anyMatch(ContentItem::isError);
    }

    /**
     * Join the text of all items, one per line.
     * @return combined text
     */
    @JsonIgnore
    public String joinedText() {
        return content.stream().map(ContentItem::text).collect(Collectors.joining("\n"));
    }
}
