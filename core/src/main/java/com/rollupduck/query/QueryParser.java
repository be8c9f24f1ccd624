package com.rollupduck.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rollupduck.exception.MalformedQueryException;
import com.rollupduck.exception.QueryAnalysisException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Parses JSON query batches into {@link Query} objects.
 *
 * <p>Expected format (one object per query):
 * <pre>
 * {
 *   "select": ["day", {"SUM": "bid_price"}],
 *   "from": "events",
 *   "where": [{"col": "type", "op": "eq", "val": "impression"},
 *             {"col": "day", "op": "between", "val": ["2024-10-20", "2024-10-23"]}],
 *   "group_by": ["day"],
 *   "order_by": [{"col": "SUM(bid_price)", "dir": "desc"}],
 *   "limit": 10
 * }
 * </pre>
 *
 * <p>Queries without an {@code "id"} field are named {@code q1, q2, ...} by
 * position. {@code "from"} is informational and ignored.
 */
public class QueryParser {

    private static final Logger logger = LoggerFactory.getLogger(QueryParser.class);

    private static final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Parses a batch, isolating per-query failures.
     *
     * <p>A query with an unknown operator or a malformed shape is recorded as a
     * failure; the remaining queries are still returned.
     *
     * @param json a JSON array of query objects
     * @return the parsed batch
     * @throws IllegalArgumentException if the document is not a JSON array
     */
    public QueryBatch parseBatch(String json) {
        return parseBatch(readTree(json));
    }

    /**
     * Parses a batch from a stream, e.g. a classpath resource.
     *
     * @param input the JSON input
     * @return the parsed batch
     * @throws IOException if the stream cannot be read
     */
    public QueryBatch parseBatch(InputStream input) throws IOException {
        return parseBatch(objectMapper.readTree(input));
    }

    /**
     * Parses a single query object.
     *
     * @param json the JSON object
     * @param defaultId the id to use when the object has no "id" field
     * @return the validated query
     * @throws QueryAnalysisException if the query is malformed or unsupported
     */
    public Query parseQuery(String json, String defaultId) {
        return parseQuery(readTree(json), defaultId);
    }

    private QueryBatch parseBatch(JsonNode root) {
        if (root == null || !root.isArray()) {
            throw new IllegalArgumentException("Query batch must be a JSON array");
        }

        List<Query> queries = new ArrayList<>();
        List<QueryFailure> failures = new ArrayList<>();
        int position = 0;
        for (JsonNode node : root) {
            position++;
            String id = idOf(node, "q" + position);
            try {
                queries.add(parseQuery(node, id));
            } catch (QueryAnalysisException e) {
                logger.warn("Query {} skipped: {}", id, e.getMessage());
                failures.add(QueryFailure.of(id, e));
            }
        }
        logger.debug("Parsed {} queries ({} failed)", queries.size(), failures.size());
        return new QueryBatch(queries, failures);
    }

    private Query parseQuery(JsonNode node, String defaultId) {
        String id = idOf(node, defaultId);
        try {
            if (node == null || !node.isObject()) {
                throw new MalformedQueryException("Query must be a JSON object", id);
            }
            Query.Builder builder = Query.builder(id);
            parseSelect(node.get("select"), builder);
            parseWhere(node.get("where"), builder);
            for (String column : textArray(node.get("group_by"), "group_by")) {
                builder.groupBy(column);
            }
            parseOrderBy(node.get("order_by"), builder);

            JsonNode limit = node.get("limit");
            if (limit != null && !limit.isNull()) {
                if (!limit.canConvertToInt()) {
                    throw new MalformedQueryException("limit must be an integer");
                }
                builder.limit(limit.asInt());
            }

            Query query = builder.build();
            QueryValidator.validate(query);
            return query;
        } catch (QueryAnalysisException e) {
            throw e.getQueryId() == null ? e.withQueryId(id) : e;
        } catch (IllegalArgumentException e) {
            throw new MalformedQueryException(e.getMessage(), e, id);
        }
    }

    private void parseSelect(JsonNode select, Query.Builder builder) {
        if (select == null || !select.isArray()) {
            throw new MalformedQueryException("select must be a JSON array");
        }
        for (JsonNode item : select) {
            if (item.isTextual()) {
                builder.select(item.asText());
            } else if (item.isObject() && item.size() == 1) {
                Map.Entry<String, JsonNode> entry = item.fields().next();
                if (!entry.getValue().isTextual()) {
                    throw new MalformedQueryException(
                        "Aggregate argument must be a column name: " + item);
                }
                builder.select(AggregateFunction.fromName(entry.getKey()), entry.getValue().asText());
            } else {
                throw new MalformedQueryException("Unsupported select item: " + item);
            }
        }
    }

    private void parseWhere(JsonNode where, Query.Builder builder) {
        if (where == null || where.isNull()) {
            return;
        }
        if (!where.isArray()) {
            throw new MalformedQueryException("where must be a JSON array");
        }
        for (JsonNode condition : where) {
            JsonNode column = condition.get("col");
            JsonNode op = condition.get("op");
            if (column == null || !column.isTextual() || op == null || !op.isTextual()) {
                throw new MalformedQueryException("Condition requires textual 'col' and 'op': " + condition);
            }
            Operator operator = Operator.fromWireName(op.asText());
            builder.where(Predicate.of(column.asText(), operator, toValue(condition.get("val"))));
        }
    }

    private void parseOrderBy(JsonNode orderBy, Query.Builder builder) {
        if (orderBy == null || orderBy.isNull()) {
            return;
        }
        if (!orderBy.isArray()) {
            throw new MalformedQueryException("order_by must be a JSON array");
        }
        for (JsonNode order : orderBy) {
            JsonNode column = order.get("col");
            if (column == null || !column.isTextual()) {
                throw new MalformedQueryException("order_by entry requires a textual 'col': " + order);
            }
            JsonNode dir = order.get("dir");
            builder.orderBy(column.asText(), SortDirection.parse(dir != null ? dir.asText() : null));
        }
    }

    private static List<String> textArray(JsonNode node, String field) {
        List<String> result = new ArrayList<>();
        if (node == null || node.isNull()) {
            return result;
        }
        if (!node.isArray()) {
            throw new MalformedQueryException(field + " must be a JSON array");
        }
        for (JsonNode element : node) {
            if (!element.isTextual()) {
                throw new MalformedQueryException(field + " entries must be column names");
            }
            result.add(element.asText());
        }
        return result;
    }

    private static Object toValue(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isArray()) {
            List<Object> values = new ArrayList<>();
            Iterator<JsonNode> elements = node.elements();
            while (elements.hasNext()) {
                values.add(toValue(elements.next()));
            }
            return values;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isBoolean()) {
            return node.asBoolean();
        }
        if (node.isIntegralNumber()) {
            return node.asLong();
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        throw new MalformedQueryException("Unsupported predicate value: " + node);
    }

    private static String idOf(JsonNode node, String defaultId) {
        if (node != null && node.hasNonNull("id")) {
            return node.get("id").asText();
        }
        return defaultId;
    }

    private static JsonNode readTree(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to parse query JSON: " + e.getOriginalMessage(), e);
        }
    }
}
