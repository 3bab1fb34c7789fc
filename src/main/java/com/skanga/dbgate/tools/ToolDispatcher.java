package com.skanga.dbgate.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.skanga.dbgate.config.ResourceManager;
import com.skanga.dbgate.db.QueryResult;
import com.skanga.dbgate.error.GatewayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps tool calls with JSON arguments onto {@link DatabaseTools} and turns the results into JSON.
 */
public class ToolDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(ToolDispatcher.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    public static final List<String> TOOL_NAMES = List.of("list_databases", "list_tables", "get_table_schema",
            "get_table_schema_with_relations", "execute_sql");

    private final DatabaseTools databaseTools;

    public ToolDispatcher(DatabaseTools databaseTools) {
        this.databaseTools = databaseTools;
    }

    /**
     * Executes the named tool.
     *
     * @param toolName  one of {@link #TOOL_NAMES}
     * @param arguments JSON object with the tool's arguments, may be null for tools without arguments
     * @return the JSON result
     * @throws GatewayException         if the database operation fails
     * @throws IllegalArgumentException if the tool is unknown or arguments are invalid
     */
    public JsonNode callTool(String toolName, JsonNode arguments) throws GatewayException {
        JsonNode argsNode = arguments == null ? MissingNode.getInstance() : arguments;
        logger.debug("Calling tool {}", toolName);

        return switch (toolName == null ? "" : toolName) {
            case "list_databases" -> objectMapper.valueToTree(databaseTools.listDatabases());
            case "list_tables" -> objectMapper.valueToTree(
                    databaseTools.listTables(textArgument(argsNode, "database_name")));
            case "get_table_schema" -> objectMapper.valueToTree(databaseTools.getTableSchema(
                    textArgument(argsNode, "database_name"), textArgument(argsNode, "table_name")));
            case "get_table_schema_with_relations" -> objectMapper.valueToTree(databaseTools.getTableSchemaWithRelations(
                    textArgument(argsNode, "database_name"), textArgument(argsNode, "table_name")));
            case "execute_sql" -> execToolExecuteSql(argsNode);
            default -> throw new IllegalArgumentException(ResourceManager.getErrorMessage("tool.unknown", toolName));
        };
    }

    /**
     * Runs {@code execute_sql}: returns the rows as an array of objects whose keys follow column order.
     */
    JsonNode execToolExecuteSql(JsonNode argsNode) throws GatewayException {
        String sqlText = textArgument(argsNode, "sql_query");
        String databaseName = textArgument(argsNode, "database_name");

        // Handle optional parameters array
        List<Object> paramList = null;
        JsonNode paramsNode = argsNode.path("parameters");
        if (!paramsNode.isMissingNode() && !paramsNode.isNull()) {
            if (!paramsNode.isArray()) {
                throw new IllegalArgumentException(
                        ResourceManager.getErrorMessage("tool.argument.not.array", "parameters"));
            }
            paramList = new ArrayList<>();
            for (JsonNode paramNode : paramsNode) {
                paramList.add(convertJsonNodeToParameter(paramNode));
            }
        }

        QueryResult queryResult = databaseTools.executeSql(sqlText, databaseName, paramList);
        if (queryResult.truncated()) {
            logger.info("Result truncated to {} rows", queryResult.rowCount());
        }
        return objectMapper.valueToTree(queryResult.allRows());
    }

    /**
     * Converts a JsonNode parameter to an appropriate Java object for PreparedStatement binding.
     * Handles JSON primitive types and converts them to corresponding Java types.
     *
     * @param paramNode The JsonNode containing the parameter value
     * @return The converted Java object suitable for PreparedStatement parameter binding
     */
    static Object convertJsonNodeToParameter(JsonNode paramNode) {
        if (paramNode == null || paramNode.isNull()) {
            return null;
        } else if (paramNode.isBoolean()) {
            return paramNode.asBoolean();
        } else if (paramNode.isInt()) {
            return paramNode.asInt();
        } else if (paramNode.isLong()) {
            return paramNode.asLong();
        } else if (paramNode.isBigInteger()) {
            return paramNode.bigIntegerValue();
        } else if (paramNode.isBigDecimal()) {
            return paramNode.decimalValue();
        } else if (paramNode.isDouble() || paramNode.isFloat()) {
            return paramNode.asDouble();
        } else if (paramNode.isTextual()) {
            return paramNode.asText();
        } else {
            // For complex types, convert to string representation
            return paramNode.toString();
        }
    }

    private static String textArgument(JsonNode argsNode, String argumentName) {
        JsonNode argumentNode = argsNode.path(argumentName);
        if (argumentNode.isMissingNode() || argumentNode.isNull()) {
            return null;
        }
        return argumentNode.asText();
    }
}
