package com.wildtrack.ats;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Loads XML fixtures from {@code src/test/resources/fixtures} and builds small inline payloads.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static String load(String name) {
        try (InputStream in = Fixtures.class.getClassLoader().getResourceAsStream("fixtures/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("Missing fixture " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** A {@code DataSet} whose {@code NewDataSet} holds the given rows verbatim. */
    public static String dataSet(String... rows) {
        StringBuilder xml = new StringBuilder()
                .append("<DataSet xmlns=\"http://tempuri.org/\">")
                .append("<diffgr:diffgram xmlns:diffgr=\"urn:schemas-microsoft-com:xml-diffgram-v1\">")
                .append("<NewDataSet xmlns=\"\">");
        for (String row : rows) {
            xml.append(row);
        }
        return xml.append("</NewDataSet></diffgr:diffgram></DataSet>").toString();
    }

    public static String table(String body) {
        return "<Table>" + body + "</Table>";
    }
}
