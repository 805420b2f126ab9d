package com.example.statements.infrastructure.xml;

import com.example.statements.domain.model.CanonicalStatement;
import com.example.statements.domain.model.StatementTransaction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
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
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Infrastructure component that turns the extractor's {@code <transaction_analysis>} XML into a
 * {@link CanonicalStatement}.
 * Extraction output is not guaranteed to be well formed, so every defect degrades to an empty string, zero or
 * absent value instead of an exception.
 */
@Component
public class CanonicalXmlReader {

    private static final Logger log = LoggerFactory.getLogger(CanonicalXmlReader.class);
    private static final String ROOT_TAG = "transaction_analysis";
    private static final Pattern ISO_DATE_PREFIX = Pattern.compile("\\d{4}-\\d{2}-\\d{2}.*");
    private static final DateTimeFormatter DAY_FIRST_FORMATTER = DateTimeFormatter.ofPattern("d/M/uuuu");
    private static final Pattern NON_NUMERIC = Pattern.compile("[^0-9.\\-]");

    private final DocumentBuilderFactory factory;

    public CanonicalXmlReader() {
        this.factory = secureFactory();
    }

    /**
     * Parses canonical XML. Surrounding text such as model chatter before or after the root element is ignored.
     *
     * @param xml raw extractor output, may be {@code null}
     * @return parsed statement, {@link CanonicalStatement#empty()} when nothing usable was found
     */
    public CanonicalStatement read(String xml) {
        if (xml == null || xml.isBlank()) {
            return CanonicalStatement.empty();
        }
        Document document = parse(isolateRoot(xml));
        if (document == null) {
            return CanonicalStatement.empty();
        }
        Element root = document.getDocumentElement();

        List<StatementTransaction> transactions = readTransactions(root);
        CanonicalStatement statement = new CanonicalStatement(
                text(root, "institution"),
                readAccountHolders(root),
                text(root, "account_type"),
                parseDate(text(root, "start_date")),
                parseDate(text(root, "end_date")),
                text(root, "account_number"),
                text(root, "account_bsb"),
                text(root, "currency"),
                parseAmountOrZero(text(root, "total_credits")),
                parseAmountOrZero(text(root, "total_debits")),
                transactions,
                readFlows(root, "inflows", "from"),
                readFlows(root, "outflows", "to"),
                text(root, "analysis_summary")
        );
        log.debug("Parsed canonical statement with {} transactions, {} explicit inflows, {} explicit outflows",
                transactions.size(), statement.explicitInflows().size(), statement.explicitOutflows().size());
        return statement;
    }

    /**
     * Parses a decimal leniently: currency symbols and thousands separators are dropped, a leading minus,
     * surrounding parentheses or a trailing {@code DR} make the value negative.
     *
     * @param raw amount text
     * @return parsed amount or {@code null} when the text holds no number
     */
    static BigDecimal parseAmount(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim().toUpperCase(Locale.ROOT);
        boolean negative = false;
        if (value.endsWith("DR")) {
            negative = true;
            value = value.substring(0, value.length() - 2);
        } else if (value.endsWith("CR")) {
            value = value.substring(0, value.length() - 2);
        }
        if (value.startsWith("(") && value.endsWith(")")) {
            negative = true;
            value = value.substring(1, value.length() - 1);
        }
        String digits = NON_NUMERIC.matcher(value).replaceAll("");
        if (digits.isEmpty() || "-".equals(digits) || ".".equals(digits)) {
            return null;
        }
        try {
            BigDecimal amount = new BigDecimal(digits);
            return negative && amount.signum() > 0 ? amount.negate() : amount;
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    /**
     * Accepts ISO dates (optionally followed by a time part) and day-first slash dates.
     *
     * @param raw date text
     * @return parsed date or {@code null}
     */
    static LocalDate parseDate(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        try {
            if (ISO_DATE_PREFIX.matcher(value).matches()) {
                return LocalDate.parse(value.substring(0, 10));
            }
            if (value.contains("/")) {
                return LocalDate.parse(value, DAY_FIRST_FORMATTER);
            }
        } catch (DateTimeParseException ex) {
            log.debug("Ignoring unparsable date '{}'", value);
        }
        return null;
    }

    private List<StatementTransaction> readTransactions(Element root) {
        NodeList nodes = root.getElementsByTagName("transaction");
        List<StatementTransaction> transactions = new ArrayList<>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            Element node = (Element) nodes.item(i);
            String rawDate = text(node, "transaction_date");
            transactions.add(new StatementTransaction(
                    rawDate,
                    parseDate(rawDate),
                    text(node, "transaction_description"),
                    parseAmountOrZero(text(node, "amount")),
                    parseAmount(text(node, "balance")),
                    text(node, "transaction_category"),
                    text(node, "transfer_type"),
                    text(node, "transfer_target")
            ));
        }
        return transactions;
    }

    private List<String> readAccountHolders(Element root) {
        NodeList holders = root.getElementsByTagName("account_holder");
        List<String> names = new ArrayList<>();
        for (int i = 0; i < holders.getLength(); i++) {
            String name = holders.item(i).getTextContent().trim();
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        if (names.isEmpty()) {
            String flat = text(root, "account_holders");
            if (!flat.isEmpty()) {
                names.add(flat);
            }
        }
        return names;
    }

    private Map<String, BigDecimal> readFlows(Element root, String containerTag, String entryTag) {
        Element container = firstElement(root, containerTag);
        NodeList entries = (container != null ? container : root).getElementsByTagName(entryTag);
        Map<String, BigDecimal> flows = new LinkedHashMap<>();
        for (int i = 0; i < entries.getLength(); i++) {
            Element entry = (Element) entries.item(i);
            String target = text(entry, "target");
            BigDecimal amount = parseAmount(text(entry, "total_amount"));
            if (!target.isEmpty() && amount != null && amount.signum() > 0) {
                flows.merge(target, amount, BigDecimal::add);
            }
        }
        return flows;
    }

    private Document parse(String xml) {
        try {
            DocumentBuilder builder = factory.newDocumentBuilder();
            // default handler prints parse errors to stderr; we log them instead
            builder.setErrorHandler(new DefaultHandler());
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (SAXException | IOException ex) {
            log.warn("Canonical XML is not well formed, continuing with an empty statement: {}", ex.getMessage());
            return null;
        } catch (ParserConfigurationException ex) {
            throw new IllegalStateException("XML parser is misconfigured", ex);
        }
    }

    private static String isolateRoot(String xml) {
        int start = xml.indexOf("<" + ROOT_TAG);
        String closing = "</" + ROOT_TAG + ">";
        int end = xml.lastIndexOf(closing);
        if (start >= 0 && end > start) {
            return xml.substring(start, end + closing.length());
        }
        return xml.trim();
    }

    private static BigDecimal parseAmountOrZero(String raw) {
        BigDecimal amount = parseAmount(raw);
        return amount != null ? amount : BigDecimal.ZERO;
    }

    private static String text(Element parent, String tagName) {
        Element element = firstElement(parent, tagName);
        return element != null ? element.getTextContent().trim() : "";
    }

    private static Element firstElement(Element parent, String tagName) {
        NodeList nodes = parent.getElementsByTagName(tagName);
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                return (Element) node;
            }
        }
        return null;
    }

    private static DocumentBuilderFactory secureFactory() {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        } catch (ParserConfigurationException ex) {
            throw new IllegalStateException("XML parser does not support secure processing", ex);
        }
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        factory.setNamespaceAware(false);
        return factory;
    }
}
