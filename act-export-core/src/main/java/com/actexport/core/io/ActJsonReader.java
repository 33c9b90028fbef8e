package com.actexport.core.io;

import com.actexport.core.model.ActData;
import com.actexport.core.model.ActNode;
import com.actexport.core.model.ActTable;
import com.actexport.core.model.AdditionalContent;
import com.actexport.core.model.Alignment;
import com.actexport.core.model.ContentItem;
import com.actexport.core.model.ContentItemType;
import com.actexport.core.model.DescriptionList;
import com.actexport.core.model.NodeType;
import com.actexport.core.model.OptionalField;
import com.actexport.core.model.TableCell;
import com.actexport.core.model.TextBlock;
import com.actexport.core.model.TextFormatting;
import com.actexport.core.model.Violation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiFunction;

/**
 * Reads a stored act snapshot {@code {tree, tables, textBlocks, violations}} into {@link ActData}.
 *
 * <p>The reader is lenient below the top level:
 * <ul>
 *   <li>any object-valued field may also arrive as a JSON-encoded string</li>
 *   <li>a string that fails to parse, or a value of the wrong shape, becomes the empty or disabled default</li>
 *   <li>satellite entities without an {@code id} take the key they are stored under</li>
 *   <li>cell back-references are read from {@code originRow}/{@code originCol} or a nested
 *       {@code spanOrigin {row, col}}; the nested form wins</li>
 * </ul>
 *
 * <p>Only an unreadable file or a document that is not JSON at all raises {@link IOException}.
 *
 * @since 1.0.0
 */
public class ActJsonReader {

    private static final Logger log = LoggerFactory.getLogger(ActJsonReader.class);

    private static final String FIELD_TREE = "tree";
    private static final String FIELD_TABLES = "tables";
    private static final String FIELD_TEXT_BLOCKS = "textBlocks";
    private static final String FIELD_VIOLATIONS = "violations";
    private static final String FIELD_ID = "id";
    private static final String FIELD_CHILDREN = "children";
    private static final String FIELD_CONTENT = "content";
    private static final String FIELD_ENABLED = "enabled";
    private static final String FIELD_ITEMS = "items";
    private static final String ROOT_ID = "root";

    /**
     * JSON mapper for parsing snapshots and embedded JSON strings.
     * Thread-safe and reusable across parse operations.
     */
    protected final ObjectMapper objectMapper;

    public ActJsonReader() {
        this(new ObjectMapper());
    }

    public ActJsonReader(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    /**
     * Reads a snapshot file.
     *
     * @param file path to the JSON snapshot
     * @return parsed snapshot
     * @throws IOException if the file cannot be read or is not JSON
     */
    public ActData read(Path file) throws IOException {
        Objects.requireNonNull(file, "file must not be null");
        log.debug("Reading act snapshot from {}", file);
        return read(Files.readString(file));
    }

    /**
     * Reads a snapshot from a JSON string.
     *
     * @param json snapshot content
     * @return parsed snapshot
     * @throws IOException if the content is not JSON
     */
    public ActData read(String json) throws IOException {
        Objects.requireNonNull(json, "json must not be null");
        return fromTree(objectMapper.readTree(json));
    }

    /**
     * Converts an already parsed snapshot.
     *
     * @param snapshot root JSON node
     * @return parsed snapshot; a missing tree yields an empty root
     */
    public ActData fromTree(JsonNode snapshot) {
        JsonNode root = asObject(snapshot, "snapshot");
        if (root == null) {
            return ActData.ofTree(ActNode.root(List.of()));
        }

        JsonNode treeNode = asObject(root.get(FIELD_TREE), FIELD_TREE);
        ActNode tree = treeNode == null ? ActNode.root(List.of()) : readNode(treeNode, ROOT_ID);

        Map<String, ActTable> tables = readEntities(root.get(FIELD_TABLES), FIELD_TABLES, this::readTable);
        Map<String, TextBlock> textBlocks =
            readEntities(root.get(FIELD_TEXT_BLOCKS), FIELD_TEXT_BLOCKS, this::readTextBlock);
        Map<String, Violation> violations =
            readEntities(root.get(FIELD_VIOLATIONS), FIELD_VIOLATIONS, this::readViolation);

        log.debug("Read act snapshot: {} tables, {} text blocks, {} violations",
            tables.size(), textBlocks.size(), violations.size());
        return new ActData(tree, tables, textBlocks, violations);
    }

    // ==================== Tree ====================

    private ActNode readNode(JsonNode node, String fallbackId) {
        String id = getTextOrDefault(node, FIELD_ID, fallbackId);
        NodeType type = NodeType.fromWireName(getTextOrDefault(node, "type", null));

        List<ActNode> children = new ArrayList<>();
        JsonNode childArray = asArray(node.get(FIELD_CHILDREN), FIELD_CHILDREN);
        if (childArray != null) {
            int index = 0;
            for (JsonNode child : childArray) {
                JsonNode childObject = asObject(child, FIELD_CHILDREN);
                if (childObject != null) {
                    children.add(readNode(childObject, id + "/" + index));
                }
                index++;
            }
        }

        return new ActNode(
            id,
            type,
            getTextOrDefault(node, "label", null),
            getTextOrDefault(node, FIELD_CONTENT, null),
            getTextOrDefault(node, "number", null),
            getTextOrDefault(node, "customLabel", null),
            children,
            getTextOrDefault(node, "tableId", null),
            getTextOrDefault(node, "textBlockId", null),
            getTextOrDefault(node, "violationId", null),
            getBooleanOrDefault(node, "protected", false),
            getBooleanOrDefault(node, "deletable", true)
        );
    }

    // ==================== Satellites ====================

    private <T> Map<String, T> readEntities(JsonNode value, String field, BiFunction<String, JsonNode, T> reader) {
        Map<String, T> result = new LinkedHashMap<>();
        JsonNode entities = asObject(value, field);
        if (entities == null) {
            return result;
        }
        Iterator<Map.Entry<String, JsonNode>> it = entities.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            JsonNode entity = asObject(entry.getValue(), field + "." + entry.getKey());
            if (entity == null) {
                continue;
            }
            String id = getTextOrDefault(entity, FIELD_ID, entry.getKey());
            result.put(id, reader.apply(id, entity));
        }
        return result;
    }

    private ActTable readTable(String id, JsonNode node) {
        List<List<TableCell>> grid = new ArrayList<>();
        JsonNode rows = asArray(node.get("grid"), "grid");
        if (rows != null) {
            for (JsonNode row : rows) {
                List<TableCell> cells = new ArrayList<>();
                if (row.isArray()) {
                    for (JsonNode cell : row) {
                        cells.add(readCell(cell));
                    }
                }
                grid.add(cells);
            }
        }

        List<Integer> colWidths = new ArrayList<>();
        JsonNode widths = asArray(node.get("colWidths"), "colWidths");
        if (widths != null) {
            for (JsonNode width : widths) {
                if (width.isNumber()) {
                    colWidths.add(width.asInt());
                }
            }
        }

        return new ActTable(
            id,
            grid,
            colWidths,
            getBooleanOrDefault(node, "isMetricsTable", false),
            getBooleanOrDefault(node, "isMainMetricsTable", false),
            getBooleanOrDefault(node, "isRegularRiskTable", false),
            getBooleanOrDefault(node, "isOperationalRiskTable", false)
        );
    }

    private TableCell readCell(JsonNode node) {
        if (node == null || !node.isObject()) {
            return TableCell.of(node != null && node.isValueNode() ? node.asText() : "");
        }
        Integer originRow = getIntegerOrNull(node, "originRow");
        Integer originCol = getIntegerOrNull(node, "originCol");
        JsonNode spanOrigin = asObject(node.get("spanOrigin"), "spanOrigin");
        if (spanOrigin != null) {
            Integer row = getIntegerOrNull(spanOrigin, "row");
            Integer col = getIntegerOrNull(spanOrigin, "col");
            if (row != null && col != null) {
                originRow = row;
                originCol = col;
            }
        }
        return new TableCell(
            getTextOrDefault(node, FIELD_CONTENT, ""),
            getBooleanOrDefault(node, "isHeader", false),
            getIntOrDefault(node, "colSpan", 1),
            getIntOrDefault(node, "rowSpan", 1),
            getBooleanOrDefault(node, "isSpanned", false),
            originRow,
            originCol
        );
    }

    private TextBlock readTextBlock(String id, JsonNode node) {
        return new TextBlock(id, getTextOrDefault(node, FIELD_CONTENT, ""), readFormatting(node.get("formatting")));
    }

    private TextFormatting readFormatting(JsonNode value) {
        JsonNode node = asObject(value, "formatting");
        if (node == null) {
            return TextFormatting.defaults();
        }
        return new TextFormatting(
            getIntOrDefault(node, "fontSize", TextFormatting.DEFAULT_FONT_SIZE),
            Alignment.fromWireName(getTextOrDefault(node, "alignment", null)),
            getBooleanOrDefault(node, "bold", false),
            getBooleanOrDefault(node, "italic", false),
            getBooleanOrDefault(node, "underline", false)
        );
    }

    private Violation readViolation(String id, JsonNode node) {
        return new Violation(
            id,
            getTextOrDefault(node, "violated", ""),
            getTextOrDefault(node, "established", ""),
            readDescriptionList(node.get("descriptionList")),
            readAdditionalContent(node.get("additionalContent")),
            readOptionalField(node.get("reasons"), "reasons"),
            readOptionalField(node.get("consequences"), "consequences"),
            readOptionalField(node.get("responsible"), "responsible"),
            readOptionalField(node.get("recommendations"), "recommendations")
        );
    }

    private DescriptionList readDescriptionList(JsonNode value) {
        JsonNode node = asObject(value, "descriptionList");
        if (node == null) {
            return DescriptionList.disabled();
        }
        List<String> items = new ArrayList<>();
        JsonNode array = asArray(node.get(FIELD_ITEMS), FIELD_ITEMS);
        if (array != null) {
            for (JsonNode item : array) {
                if (item.isValueNode() && !item.isNull()) {
                    items.add(item.asText());
                }
            }
        }
        return new DescriptionList(getBooleanOrDefault(node, FIELD_ENABLED, false), items);
    }

    private AdditionalContent readAdditionalContent(JsonNode value) {
        JsonNode node = asObject(value, "additionalContent");
        if (node == null) {
            return AdditionalContent.disabled();
        }
        List<ContentItem> items = new ArrayList<>();
        JsonNode array = asArray(node.get(FIELD_ITEMS), FIELD_ITEMS);
        if (array != null) {
            for (JsonNode item : array) {
                if (!item.isObject()) {
                    continue;
                }
                items.add(new ContentItem(
                    getTextOrDefault(item, FIELD_ID, null),
                    ContentItemType.fromWireName(getTextOrDefault(item, "type", null)),
                    getTextOrDefault(item, FIELD_CONTENT, ""),
                    getTextOrDefault(item, "url", ""),
                    getTextOrDefault(item, "caption", ""),
                    getTextOrDefault(item, "filename", ""),
                    getIntOrDefault(item, "order", 0)
                ));
            }
        }
        return new AdditionalContent(getBooleanOrDefault(node, FIELD_ENABLED, false), items);
    }

    private OptionalField readOptionalField(JsonNode value, String field) {
        JsonNode node = asObject(value, field);
        if (node == null) {
            return OptionalField.disabled();
        }
        return new OptionalField(getBooleanOrDefault(node, FIELD_ENABLED, false),
            getTextOrDefault(node, FIELD_CONTENT, ""));
    }

    // ==================== Lenient field access ====================

    /**
     * Resolves a value that should be an object, decoding it first when it is a JSON string.
     *
     * @param value raw value, may be null
     * @param field field name for logging
     * @return object node, or null when absent, undecodable or of another shape
     */
    JsonNode asObject(JsonNode value, String field) {
        JsonNode decoded = decode(value, field);
        if (decoded != null && !decoded.isObject()) {
            log.debug("Ignoring field '{}': expected object but got {}", field, decoded.getNodeType());
            return null;
        }
        return decoded;
    }

    /**
     * Resolves a value that should be an array, decoding it first when it is a JSON string.
     *
     * @param value raw value, may be null
     * @param field field name for logging
     * @return array node, or null when absent, undecodable or of another shape
     */
    JsonNode asArray(JsonNode value, String field) {
        JsonNode decoded = decode(value, field);
        if (decoded != null && !decoded.isArray()) {
            log.debug("Ignoring field '{}': expected array but got {}", field, decoded.getNodeType());
            return null;
        }
        return decoded;
    }

    private JsonNode decode(JsonNode value, String field) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        if (!value.isTextual()) {
            return value;
        }
        String text = value.asText();
        if (text.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.warn("Field '{}' holds malformed JSON, using default: {}", field, e.getOriginalMessage());
            return null;
        }
    }

    private String getTextOrDefault(JsonNode node, String field, String defaultValue) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return defaultValue;
        }
        return value.asText();
    }

    private boolean getBooleanOrDefault(JsonNode node, String field, boolean defaultValue) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        return value.isValueNode() ? value.asBoolean(defaultValue) : defaultValue;
    }

    private int getIntOrDefault(JsonNode node, String field, int defaultValue) {
        Integer value = getIntegerOrNull(node, field);
        return value == null ? defaultValue : value;
    }

    private Integer getIntegerOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.asInt();
        }
        if (value.isTextual()) {
            try {
                return Integer.parseInt(value.asText().trim());
            } catch (NumberFormatException e) {
                log.debug("Field '{}' is not a number: {}", field, value.asText());
            }
        }
        return null;
    }
}
