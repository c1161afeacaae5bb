package com.txwatch.tracking;

import com.txwatch.domain.TransactionEntry;
import com.txwatch.domain.TransactionType;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TransactionCsvWriterTest {

    @Test
    void header_isUnquoted() {
        assertThat(TransactionCsvWriter.write(List.of()))
                .isEqualTo("ID,Signature,Type,Status,Timestamp,From,To,Amount,Token,Fee,Confirmations,Error");
    }

    @Test
    void row_quotesEveryFieldAndFormatsTimestampInUtc() {
        TransactionEntry entry = TransactionEntry.pending("tx_1", "5sig", TransactionType.TRANSFER, "Alice", null,
                Instant.parse("2025-03-01T08:30:05.120Z"));
        entry.describe("Bob", "USDC", new BigDecimal("12.50"));
        entry.confirm(99L, 2, 800L);
        entry.enrich(new BigDecimal("0.000005"), null, null);

        String[] lines = TransactionCsvWriter.write(List.of(entry)).split("\n");

        assertThat(lines).hasSize(2);
        assertThat(lines[1]).isEqualTo(
                "\"tx_1\",\"5sig\",\"TRANSFER\",\"CONFIRMED\",\"2025-03-01T08:30:05.120Z\",\"Alice\",\"Bob\","
                        + "\"12.50\",\"USDC\",\"0.000005\",\"2\",\"\"");
    }

    @Test
    void quote_doublesQuotesAndFlattensLineBreaks() {
        assertThat(TransactionCsvWriter.quote("say \"hi\"")).isEqualTo("\"say \"\"hi\"\"\"");
        assertThat(TransactionCsvWriter.quote("line1\r\nline2\nline3")).isEqualTo("\"line1 line2 line3\"");
        assertThat(TransactionCsvWriter.quote(null)).isEqualTo("\"\"");
    }

    @Test
    void failedEntry_errorWithCommaStaysInOneField() {
        TransactionEntry entry = TransactionEntry.pending("tx_2", "sig", TransactionType.SWAP, "Alice", null,
                Instant.parse("2025-03-01T00:00:00Z"));
        entry.fail("{\"InstructionError\":[0,\"Custom\"]}", 0);

        String row = TransactionCsvWriter.write(List.of(entry)).split("\n")[1];

        assertThat(row).endsWith(",\"0\",\"{\"\"InstructionError\"\":[0,\"\"Custom\"\"]}\"");
    }
}
