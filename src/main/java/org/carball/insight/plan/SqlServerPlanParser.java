package org.carball.insight.plan;

import org.carball.insight.model.plan.PlanIssue;
import org.carball.insight.model.plan.PlanIssueSeverity;
import org.carball.insight.model.plan.PlanIssueType;
import org.carball.insight.model.plan.PlanNode;
import org.carball.insight.model.plan.QueryPlanResult;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Parses SQL Server showplan XML into a plan tree and flags scans, key lookups, sorts and
 * large hash matches.
 */
public final class SqlServerPlanParser {

    public static final String SHOWPLAN_NAMESPACE = "http://schemas.microsoft.com/sqlserver/2004/07/showplan";

    static final long SCAN_CRITICAL_ROWS = 10_000;
    static final long HASH_MATCH_ROW_THRESHOLD = 100_000;

    // RelOp children that describe the operator rather than being the operator
    private static final Set<String> NON_OPERATOR_ELEMENTS = Set.of(
            "OutputList", "Warnings", "MemoryFractions", "RunTimeInformation", "RunTimePartitionSummary",
            "InternalInfo", "DefinedValues");

    private static final Set<String> INDEX_SCAN_OPERATIONS = Set.of("Index Scan", "Clustered Index Scan");
    private static final Set<String> LOOKUP_OPERATIONS = Set.of("Key Lookup", "RID Lookup");

    private SqlServerPlanParser() {
        // Utility class - prevent instantiation
    }

    /**
     * @throws IllegalArgumentException when the text is not well-formed XML
     */
    public static QueryPlanResult parse(String sql, String rawPlan) {
        QueryPlanResult.QueryPlanResultBuilder builder = QueryPlanResult.builder()
                .sql(sql)
                .engine(SqlServerPlanProvider.ENGINE)
                .rawPlan(rawPlan == null ? "" : rawPlan);
        if (rawPlan == null || rawPlan.isBlank()) {
            return builder.build();
        }

        Document document = readDocument(rawPlan);
        List<PlanNode> roots = new ArrayList<>();
        NodeList statements = document.getElementsByTagNameNS(SHOWPLAN_NAMESPACE, "StmtSimple");
        for (int i = 0; i < statements.getLength(); i++) {
            Element statement = (Element) statements.item(i);
            if (i == 0) {
                builder.estimatedCost(parseDouble(statement.getAttribute("StatementSubTreeCost")))
                        .estimatedRows(parseLong(statement.getAttribute("StatementEstRows")));
            }
            Element queryPlan = firstChild(statement, "QueryPlan");
            Element relOp = queryPlan != null ? firstChild(queryPlan, "RelOp") : null;
            if (relOp != null) {
                roots.add(parseRelOp(relOp, 0));
            }
        }

        return builder.nodes(roots)
                .issues(detectIssues(roots))
                .build();
    }

    static PlanNode parseRelOp(Element relOp, int depth) {
        String physicalOp = attributeOrNull(relOp, "PhysicalOp");
        String logicalOp = attributeOrNull(relOp, "LogicalOp");
        Element operator = operatorElement(relOp);

        PlanNode.PlanNodeBuilder builder = PlanNode.builder()
                .operation(physicalOp != null ? physicalOp : "Unknown")
                .estimatedRows(parseLong(relOp.getAttribute("EstimateRows")))
                .estimatedCost(parseDouble(relOp.getAttribute("EstimatedTotalSubtreeCost")))
                .depth(depth);

        String indexName = null;
        if (operator != null) {
            Element object = firstChild(operator, "Object");
            String table = object != null ? trimBrackets(attributeOrNull(object, "Table")) : null;
            String index = object != null ? trimBrackets(attributeOrNull(object, "Index")) : null;

            switch (operator.getLocalName()) {
                case "TableScan":
                    builder.objectName(table).tableScan(true);
                    break;
                case "IndexScan":
                    indexName = index;
                    boolean seek = isSeek(operator, physicalOp);
                    boolean lookup = isLookup(operator, physicalOp);
                    builder.objectName(table).indexName(index).usesIndex(true).lookup(lookup).tableScan(!seek && !lookup);
                    break;
                case "IndexSeek":
                    indexName = index;
                    builder.objectName(table).indexName(index).usesIndex(true);
                    break;
                default:
                    if (table != null) {
                        builder.objectName(table);
                    }
                    break;
            }

            for (Element child : childRelOps(operator)) {
                builder.child(parseRelOp(child, depth + 1));
            }
        }

        builder.details(buildDetails(logicalOp, indexName));
        return builder.build();
    }

    public static List<PlanIssue> detectIssues(List<PlanNode> roots) {
        List<PlanIssue> issues = new ArrayList<>();
        roots.forEach(root -> root.walk(node -> inspect(node, issues)));
        return issues;
    }

    private static void inspect(PlanNode node, List<PlanIssue> issues) {
        String operation = node.getOperation();
        String table = node.getObjectName();
        Long estimated = node.getEstimatedRows();
        boolean large = estimated != null && estimated > SCAN_CRITICAL_ROWS;

        if ("Table Scan".equals(operation) && table != null) {
            issues.add(PlanIssue.builder()
                    .type(PlanIssueType.TABLE_SCAN)
                    .severity(large ? PlanIssueSeverity.CRITICAL : PlanIssueSeverity.WARNING)
                    .title("Table Scan Detected")
                    .message(String.format("Table '%s' is being fully scanned%s. Consider adding an index on the "
                            + "columns used in WHERE or JOIN clauses.", table,
                            estimated != null ? String.format(" (%,d estimated rows)", estimated) : ""))
                    .suggestedFix(String.format("CREATE NONCLUSTERED INDEX IX_%1$s_<column> ON %1$s (<column>);", table))
                    .table(table)
                    .sourceNode(node)
                    .build());
        }

        if (INDEX_SCAN_OPERATIONS.contains(operation) && node.isTableScan() && table != null) {
            issues.add(PlanIssue.builder()
                    .type(PlanIssueType.INDEX_SCAN)
                    .severity(large ? PlanIssueSeverity.WARNING : PlanIssueSeverity.INFO)
                    .title(operation)
                    .message(String.format("Index '%s' on '%s' is being scanned rather than seeked. "
                            + "Consider adding a nonclustered index for better selectivity.", node.getIndexName(), table))
                    .table(table)
                    .indexName(node.getIndexName())
                    .sourceNode(node)
                    .build());
        }

        if ((node.isLookup() || LOOKUP_OPERATIONS.contains(operation)) && table != null) {
            String lookupKind = LOOKUP_OPERATIONS.contains(operation) ? operation : "Key Lookup";
            issues.add(PlanIssue.builder()
                    .type(PlanIssueType.KEY_LOOKUP)
                    .severity(PlanIssueSeverity.WARNING)
                    .title("Key Lookup Detected")
                    .message(String.format("A %s is being performed on '%s'. Consider creating a covering index "
                            + "that includes all required columns.", lookupKind, table))
                    .suggestedFix(String.format("CREATE NONCLUSTERED INDEX IX_%1$s_covering ON %1$s (<key_columns>) "
                            + "INCLUDE (<select_columns>);", table))
                    .table(table)
                    .indexName(node.getIndexName())
                    .sourceNode(node)
                    .build());
        }

        if ("Sort".equals(operation)) {
            issues.add(PlanIssue.builder()
                    .type(PlanIssueType.SORT_SPILL)
                    .severity(PlanIssueSeverity.INFO)
                    .title("Sort Operation")
                    .message("A sort operation is being performed. "
                            + "Consider adding an index on ORDER BY columns to eliminate the sort.")
                    .sourceNode(node)
                    .build());
        }

        if ("Hash Match".equals(operation) && estimated != null && estimated > HASH_MATCH_ROW_THRESHOLD) {
            issues.add(PlanIssue.builder()
                    .type(PlanIssueType.HASH_SPILL)
                    .severity(PlanIssueSeverity.WARNING)
                    .title("Large Hash Match")
                    .message(String.format("Hash match operation on %,d estimated rows. "
                            + "This may spill to disk if memory is insufficient.", estimated))
                    .sourceNode(node)
                    .build());
        }
    }

    private static boolean isSeek(Element indexScan, String physicalOp) {
        return "Seek".equalsIgnoreCase(indexScan.getAttribute("ScanType"))
                || (physicalOp != null && physicalOp.contains("Seek"))
                || firstChild(indexScan, "SeekPredicates") != null;
    }

    private static boolean isLookup(Element indexScan, String physicalOp) {
        String lookup = indexScan.getAttribute("Lookup");
        return "1".equals(lookup) || "true".equalsIgnoreCase(lookup)
                || (physicalOp != null && LOOKUP_OPERATIONS.contains(physicalOp));
    }

    private static Element operatorElement(Element relOp) {
        for (Node child = relOp.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child instanceof Element element && isShowplan(element)
                    && !NON_OPERATOR_ELEMENTS.contains(element.getLocalName())) {
                return element;
            }
        }
        return null;
    }

    // RelOps whose nearest RelOp ancestor is the operator's own RelOp
    private static List<Element> childRelOps(Element operator) {
        List<Element> result = new ArrayList<>();
        collectRelOps(operator, result);
        return result;
    }

    private static void collectRelOps(Element parent, List<Element> result) {
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child instanceof Element element && isShowplan(element)) {
                if ("RelOp".equals(element.getLocalName())) {
                    result.add(element);
                } else {
                    collectRelOps(element, result);
                }
            }
        }
    }

    private static Element firstChild(Element parent, String localName) {
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child instanceof Element element && isShowplan(element) && localName.equals(element.getLocalName())) {
                return element;
            }
        }
        return null;
    }

    private static boolean isShowplan(Element element) {
        return SHOWPLAN_NAMESPACE.equals(element.getNamespaceURI());
    }

    private static Document readDocument(String xml) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setExpandEntityReferences(false);
            DocumentBuilder documentBuilder = factory.newDocumentBuilder();
            documentBuilder.setErrorHandler(new DefaultHandler());
            return documentBuilder.parse(new InputSource(new StringReader(xml)));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new IllegalArgumentException("Invalid showplan XML: " + e.getMessage(), e);
        }
    }

    private static String buildDetails(String logicalOp, String indexName) {
        List<String> parts = new ArrayList<>();
        if (logicalOp != null && !logicalOp.isEmpty()) {
            parts.add("Logical: " + logicalOp);
        }
        if (indexName != null && !indexName.isEmpty()) {
            parts.add("Index: " + indexName);
        }
        return parts.isEmpty() ? null : String.join("; ", parts);
    }

    private static String attributeOrNull(Element element, String name) {
        return element.hasAttribute(name) ? element.getAttribute(name) : null;
    }

    private static String trimBrackets(String identifier) {
        if (identifier == null) {
            return null;
        }
        return identifier.replace("[", "").replace("]", "");
    }

    private static Double parseDouble(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Long parseLong(String value) {
        Double parsed = parseDouble(value);
        return parsed != null ? Long.valueOf(Math.round(parsed)) : null;
    }
}
