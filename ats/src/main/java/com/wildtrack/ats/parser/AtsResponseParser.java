package com.wildtrack.ats.parser;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.wildtrack.ats.model.VendorLocationRecord;
import com.wildtrack.ats.model.VendorTransmissionRecord;
import com.wildtrack.ats.model.VendorValues;
import lombok.extern.slf4j.Slf4j;

import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.IOException;
import java.io.StringReader;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads ATS web-service responses into typed records.
 *
 * <p>Both endpoints answer with a .NET {@code DataSet}:
 * <pre>
 *   &lt;DataSet&gt;
 *     &lt;xs:schema&gt;…&lt;/xs:schema&gt;
 *     &lt;diffgr:diffgram&gt;
 *       &lt;NewDataSet&gt;
 *         &lt;Table&gt;…&lt;/Table&gt;
 *         &lt;Table&gt;…&lt;/Table&gt;
 *       &lt;/NewDataSet&gt;
 *     &lt;/diffgr:diffgram&gt;
 *   &lt;/DataSet&gt;
 * </pre>
 *
 * <h3>Error policy</h3>
 * <ul>
 *   <li>Not well-formed XML, or a root other than {@code DataSet}: {@link MalformedResponseException}.</li>
 *   <li>No {@code diffgram}, no {@code NewDataSet}, or no rows: an empty result.</li>
 *   <li>A row failing field validation rejects the whole response.</li>
 * </ul>
 *
 * <p>Only the device id, the timestamp and the coordinates are validated on location rows;
 * every other field is carried verbatim.</p>
 */
@Slf4j
public class AtsResponseParser {

    static final String ROOT_ELEMENT = "DataSet";
    static final String DIFFGRAM_ELEMENT = "diffgram";
    static final String NEW_DATASET_ELEMENT = "NewDataSet";

    private final XmlMapper xmlMapper;

    public AtsResponseParser() {
        this.xmlMapper = XmlMapper.builder()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .build();
    }

    // ── Data points ──────────────────────────────────────────────────────

    /**
     * Parses a data-points response and groups the fixes by device, devices in first-seen
     * order and fixes in document order.
     */
    public Map<String, List<VendorLocationRecord>> parseLocations(String rawXml, ParseContext context) {
        List<ObjectNode> rows = readRows(rawXml, context, "data");
        if (rows.isEmpty()) {
            log.info("-- No data points extracted for endpoint {} --", context.getEndpoint());
            return Collections.emptyMap();
        }

        Map<String, List<VendorLocationRecord>> perDevice = new LinkedHashMap<>();
        for (int i = 0; i < rows.size(); i++) {
            VendorLocationRecord record;
            try {
                record = toLocationRecord(rows.get(i));
            } catch (RowValidationException e) {
                throw reject("Error while parsing 'data' response rows from XML (row " + i + ")",
                        context, e);
            }
            perDevice.computeIfAbsent(record.getAtsSerialNum(), k -> new ArrayList<>()).add(record);
        }

        perDevice.forEach((serialNum, points) ->
                log.info("-- Extracted {} data points for device {} --", points.size(), serialNum));
        return perDevice;
    }

    // ── Transmissions ────────────────────────────────────────────────────

    /**
     * Parses a transmissions response, keeping document order.
     */
    public List<VendorTransmissionRecord> parseTransmissions(String rawXml, ParseContext context) {
        List<ObjectNode> rows = readRows(rawXml, context, "transmissions");
        if (rows.isEmpty()) {
            log.info("-- No transmissions extracted for endpoint {} --", context.getEndpoint());
            return Collections.emptyList();
        }

        List<VendorTransmissionRecord> transmissions = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            try {
                transmissions.add(toTransmissionRecord(rows.get(i)));
            } catch (RowValidationException e) {
                throw reject("Error while parsing 'transmissions' response rows from XML (row " + i + ")",
                        context, e);
            }
        }
        log.info("-- Extracted {} transmissions --", transmissions.size());
        return transmissions;
    }

    // ──────────────────────── internals ──────────────────────────────────

    private List<ObjectNode> readRows(String rawXml, ParseContext context, String kind) {
        String xml = rawXml == null ? "" : rawXml;
        JsonNode dataSet;
        try {
            String root = scanRootElement(xml);
            if (root == null) {
                throw reject("No root element in '" + kind + "' response", context, null);
            }
            if (!ROOT_ELEMENT.equals(root)) {
                throw reject("Unexpected root element '" + root + "' in '" + kind
                        + "' response, expected '" + ROOT_ELEMENT + "'", context, null);
            }
            dataSet = xmlMapper.readTree(xml);
        } catch (XMLStreamException | IOException e) {
            throw reject("Error while parsing XML from '" + kind + "' endpoint", context, e);
        }

        JsonNode diffgram = dataSet == null ? null : dataSet.get(DIFFGRAM_ELEMENT);
        JsonNode newDataSet = diffgram == null ? null : diffgram.get(NEW_DATASET_ELEMENT);
        return RowSetNormalizer.normalize(newDataSet);
    }

    /**
     * Reads the whole document through to its end, so content after the root element is
     * caught as well, and returns the root's local name ({@code null} when there is none).
     */
    private String scanRootElement(String xml) throws XMLStreamException {
        XMLStreamReader reader = xmlMapper.getFactory().getXMLInputFactory()
                .createXMLStreamReader(new StringReader(xml));
        try {
            String root = null;
            while (reader.hasNext()) {
                if (reader.next() == XMLStreamConstants.START_ELEMENT && root == null) {
                    root = reader.getLocalName();
                }
            }
            return root;
        } finally {
            reader.close();
        }
    }

    private MalformedResponseException reject(String message, ParseContext context, Throwable cause) {
        String fullMessage = message + ". Integration ID: " + context.getIntegrationId()
                + " Username: " + context.getUsername();
        MalformedResponseException exception = new MalformedResponseException(fullMessage, context, cause);
        log.atError()
                .setCause(cause)
                .addKeyValue("attention_needed", true)
                .addKeyValue("integration_id", context.getIntegrationId())
                .addKeyValue("endpoint", context.getEndpoint())
                .addKeyValue("username", context.getUsername())
                .log(exception.getMessage());
        return exception;
    }

    private VendorLocationRecord toLocationRecord(ObjectNode row) {
        return VendorLocationRecord.builder()
                .atsSerialNum(requiredText(row, "AtsSerialNum"))
                .longitude(coordinate(row, "Longitude", -180.0, 360.0))
                .latitude(coordinate(row, "Latitude", -90.0, 90.0))
                .dateYearAndJulian(requiredTimestamp(row, "DateYearAndJulian"))
                .numSats(text(row, "NumSats"))
                .hdop(text(row, "Hdop"))
                .fixTime(text(row, "FixTime"))
                .dimension(text(row, "Dimension"))
                .activity(text(row, "Activity"))
                .temperature(text(row, "Temperature"))
                .mortality(text(row, "Mortality"))
                .lowBattVoltage(text(row, "LowBattVoltage"))
                .build();
    }

    private VendorTransmissionRecord toTransmissionRecord(ObjectNode row) {
        return VendorTransmissionRecord.builder()
                .dateSent(requiredTimestamp(row, "DateSent"))
                .collarSerialNum(requiredText(row, "CollarSerialNum"))
                .numberFixes(integer(row, "NumberFixes"))
                .battVoltage(decimal(row, "BattVoltage"))
                .mortality(text(row, "Mortality"))
                .breakOff(text(row, "BreakOff"))
                .satErrors(text(row, "SatErrors"))
                .yearBase(text(row, "YearBase"))
                .dayBase(text(row, "DayBase"))
                .gmtOffset(integer(row, "GmtOffset"))
                .lowBattVoltage(bool(row, "LowBattVoltage"))
                .build();
    }

    // ── Field readers ────────────────────────────────────────────────────

    /**
     * Text content of a field; {@code null} when absent or empty.  Elements carrying
     * attributes show up as objects whose text sits under the empty key.
     */
    private static String text(ObjectNode row, String field) {
        JsonNode node = row.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isObject()) {
            node = node.get("");
            if (node == null) {
                return null;
            }
        }
        if (!node.isValueNode()) {
            throw new RowValidationException("Field '" + field + "' is not a scalar value");
        }
        String value = node.asText();
        return value.isEmpty() ? null : value;
    }

    private static String requiredText(ObjectNode row, String field) {
        String value = text(row, field);
        if (value == null || value.isBlank()) {
            throw new RowValidationException("Field '" + field + "' is required");
        }
        return value;
    }

    private static LocalDateTime requiredTimestamp(ObjectNode row, String field) {
        String value = requiredText(row, field);
        try {
            return VendorValues.parseTimestamp(value);
        } catch (DateTimeParseException e) {
            throw new RowValidationException("Field '" + field + "' is not a valid timestamp: " + value);
        }
    }

    private static Double coordinate(ObjectNode row, String field, double min, double max) {
        Double value = decimal(row, field);
        if (value != null && (value < min || value > max)) {
            throw new RowValidationException("Field '" + field + "' out of range [" + min + ", " + max + "]: " + value);
        }
        return value;
    }

    private static Double decimal(ObjectNode row, String field) {
        String value = text(row, field);
        if (value == null) {
            return null;
        }
        try {
            double parsed = Double.parseDouble(value.trim());
            if (!Double.isFinite(parsed)) {
                throw new RowValidationException("Field '" + field + "' is not a finite number: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new RowValidationException("Field '" + field + "' is not a number: " + value);
        }
    }

    private static Integer integer(ObjectNode row, String field) {
        String value = text(row, field);
        if (value == null) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new RowValidationException("Field '" + field + "' is not an integer: " + value);
        }
    }

    private static Boolean bool(ObjectNode row, String field) {
        String value = text(row, field);
        if (value == null) {
            return null;
        }
        return VendorValues.parseBoolean(value)
                .orElseThrow(() -> new RowValidationException("Field '" + field + "' is not a boolean: " + value));
    }

    /** A single row failed validation; turned into a rejection of the whole response. */
    private static final class RowValidationException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        RowValidationException(String message) {
            super(message);
        }
    }
}
