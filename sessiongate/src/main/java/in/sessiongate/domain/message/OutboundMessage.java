package in.sessiongate.domain.message;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.sessiongate.domain.common.ErrorCode;
import in.sessiongate.domain.common.GatewayException;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Validated outbound message content handed to the session socket.
 *
 * Content shapes:
 * - text:    {text}
 * - media:   {url | base64, mimetype, fileName, caption, ptt, gifPlayback}
 * - buttons: {text, footer, buttons: [{id, title}]}
 * - list:    {text, buttonText, title, footer, sections: [{title, rows: [{id, title, description}]}]}
 * - poll:    {name, values: [...], selectableCount}
 */
public record OutboundMessage(MessageKind kind, ObjectNode content) {

    public static final int MAX_TEXT_LENGTH = 4096;
    public static final int MAX_BUTTONS = 3;
    public static final int MAX_SECTIONS = 10;
    public static final int MIN_POLL_OPTIONS = 2;
    public static final int MAX_POLL_OPTIONS = 12;

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    public static OutboundMessage text(String text) {
        ObjectNode content = NODES.objectNode();
        content.put("text", requireText(text, "message"));
        return new OutboundMessage(MessageKind.TEXT, content);
    }

    /**
     * Media message from a request body {@code {type, media: {...}, caption}}.
     */
    public static OutboundMessage media(JsonNode body) {
        MessageKind kind = MessageKind.mediaKind(optText(body, "type"));
        if (kind == null) {
            throw invalid("type must be one of image, video, audio, document");
        }

        JsonNode media = body.path("media");
        if (!media.isObject()) {
            throw invalid("media object is required");
        }

        String url = optText(media, "url");
        String base64 = optText(media, "base64");
        if ((url == null) == (base64 == null)) {
            throw invalid("exactly one of media.url or media.base64 is required");
        }
        if (url != null && !(url.startsWith("http://") || url.startsWith("https://"))) {
            throw invalid("media.url must be http(s)");
        }

        ObjectNode content = NODES.objectNode();
        if (url != null) content.put("url", url);
        if (base64 != null) content.put("base64", base64);
        putIfPresent(content, "mimetype", optText(media, "mimetype"));
        putIfPresent(content, "fileName", optText(media, "fileName"));

        String caption = optText(body, "caption");
        if (caption != null) {
            if (kind == MessageKind.AUDIO) {
                throw invalid("audio does not accept a caption");
            }
            content.put("caption", limit(caption));
        }
        if (kind == MessageKind.AUDIO && media.path("ptt").asBoolean(false)) {
            content.put("ptt", true);
        }
        if (kind == MessageKind.VIDEO && media.path("gifPlayback").asBoolean(false)) {
            content.put("gifPlayback", true);
        }
        return new OutboundMessage(kind, content);
    }

    /**
     * Buttons message from {@code {text, footer?, buttons: [{id, title}]}}.
     */
    public static OutboundMessage buttons(JsonNode body) {
        ObjectNode content = NODES.objectNode();
        content.put("text", requireText(optText(body, "text"), "text"));
        putIfPresent(content, "footer", optText(body, "footer"));

        JsonNode buttons = body.path("buttons");
        if (!buttons.isArray() || buttons.isEmpty() || buttons.size() > MAX_BUTTONS) {
            throw invalid("buttons must contain 1 to " + MAX_BUTTONS + " entries");
        }

        ArrayNode out = content.putArray("buttons");
        Set<String> ids = new LinkedHashSet<>();
        for (JsonNode b : buttons) {
            String id = optText(b, "id");
            String title = optText(b, "title");
            if (id == null || title == null) {
                throw invalid("each button needs id and title");
            }
            if (!ids.add(id)) {
                throw invalid("duplicate button id: " + id);
            }
            out.addObject().put("id", id).put("title", title);
        }
        return new OutboundMessage(MessageKind.BUTTONS, content);
    }

    /**
     * List message from {@code {text, buttonText, title?, footer?, sections: [{title, rows}]}}.
     */
    public static OutboundMessage list(JsonNode body) {
        ObjectNode content = NODES.objectNode();
        content.put("text", requireText(optText(body, "text"), "text"));
        content.put("buttonText", requireText(optText(body, "buttonText"), "buttonText"));
        putIfPresent(content, "title", optText(body, "title"));
        putIfPresent(content, "footer", optText(body, "footer"));

        JsonNode sections = body.path("sections");
        if (!sections.isArray() || sections.isEmpty() || sections.size() > MAX_SECTIONS) {
            throw invalid("sections must contain 1 to " + MAX_SECTIONS + " entries");
        }

        ArrayNode outSections = content.putArray("sections");
        for (JsonNode section : sections) {
            JsonNode rows = section.path("rows");
            if (!rows.isArray() || rows.isEmpty()) {
                throw invalid("each section needs at least one row");
            }
            ObjectNode outSection = outSections.addObject();
            putIfPresent(outSection, "title", optText(section, "title"));
            ArrayNode outRows = outSection.putArray("rows");
            for (JsonNode row : rows) {
                String id = optText(row, "id");
                String title = optText(row, "title");
                if (id == null || title == null) {
                    throw invalid("each row needs id and title");
                }
                ObjectNode outRow = outRows.addObject().put("id", id).put("title", title);
                putIfPresent(outRow, "description", optText(row, "description"));
            }
        }
        return new OutboundMessage(MessageKind.LIST, content);
    }

    /**
     * Poll from {@code {question, options: [...], selectableCount?}}.
     * selectableCount is clamped to [1, options].
     */
    public static OutboundMessage poll(JsonNode body) {
        String question = requireText(optText(body, "question"), "question");

        JsonNode options = body.path("options");
        if (!options.isArray()) {
            throw invalid("options must be an array");
        }
        Set<String> values = new LinkedHashSet<>();
        for (JsonNode option : options) {
            String value = option.isTextual() ? option.asText().trim() : "";
            if (!value.isEmpty()) {
                values.add(value);
            }
        }
        if (values.size() < MIN_POLL_OPTIONS || values.size() > MAX_POLL_OPTIONS) {
            throw invalid("poll needs " + MIN_POLL_OPTIONS + " to " + MAX_POLL_OPTIONS + " distinct options");
        }

        int selectable = body.path("selectableCount").asInt(1);
        selectable = Math.max(1, Math.min(selectable, values.size()));

        ObjectNode content = NODES.objectNode();
        content.put("name", question);
        ArrayNode out = content.putArray("values");
        values.forEach(out::add);
        content.put("selectableCount", selectable);
        return new OutboundMessage(MessageKind.POLL, content);
    }

    // ═══════════════════════════════════════════════════════════════
    // HELPERS
    // ═══════════════════════════════════════════════════════════════

    private static String requireText(String value, String field) {
        String text = value == null ? "" : value.trim();
        if (text.isEmpty()) {
            throw invalid(field + " is required");
        }
        if (text.length() > MAX_TEXT_LENGTH) {
            throw invalid(field + " exceeds " + MAX_TEXT_LENGTH + " characters");
        }
        return text;
    }

    private static String limit(String value) {
        return value.length() > MAX_TEXT_LENGTH ? value.substring(0, MAX_TEXT_LENGTH) : value;
    }

    private static String optText(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || !value.isTextual()) return null;
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null) node.put(field, value);
    }

    private static GatewayException invalid(String message) {
        return new GatewayException(ErrorCode.INVALID_MESSAGE, message);
    }
}
