package com.txwatch.tracking;

import com.txwatch.domain.TransactionEntry;

import java.math.BigDecimal;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.StringJoiner;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Renders entries as CSV: one header row, then one row per entry with every field double-quoted.
 * Line breaks inside a field are flattened to spaces so each entry stays on a single line.
 */
public final class TransactionCsvWriter {

    static final List<String> HEADERS = List.of(
            "ID", "Signature", "Type", "Status", "Timestamp", "From", "To",
            "Amount", "Token", "Fee", "Confirmations", "Error");

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private TransactionCsvWriter() {
    }

    public static String write(List<TransactionEntry> entries) {
        StringJoiner lines = new StringJoiner("\n");
        lines.add(String.join(",", HEADERS));
        for (TransactionEntry e : entries) {
            lines.add(row(e));
        }
        return lines.toString();
    }

    private static String row(TransactionEntry e) {
        return Stream.of(
                        e.getId(),
                        e.getSignature(),
                        e.getType() != null ? e.getType().name() : "",
                        e.getStatus() != null ? e.getStatus().name() : "",
                        e.getCreatedAt() != null ? TIMESTAMP.format(e.getCreatedAt()) : "",
                        e.getFrom(),
                        e.getTo(),
                        plain(e.getAmount()),
                        e.getToken(),
                        plain(e.getFee()),
                        e.getConfirmations() != null ? e.getConfirmations().toString() : "",
                        e.getError())
                .map(TransactionCsvWriter::quote)
                .collect(Collectors.joining(","));
    }

    private static String plain(BigDecimal value) {
        return value != null ? value.toPlainString() : "";
    }

    static String quote(String value) {
        if (value == null) {
            return "\"\"";
        }
        String flat = value.replace("\r\n", " ").replace('\n', ' ').replace('\r', ' ');
        return "\"" + flat.replace("\"", "\"\"") + "\"";
    }
}
