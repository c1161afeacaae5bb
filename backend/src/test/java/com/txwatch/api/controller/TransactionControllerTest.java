package com.txwatch.api.controller;

import com.txwatch.domain.TransactionEntry;
import com.txwatch.domain.TransactionStatus;
import com.txwatch.domain.TransactionType;
import com.txwatch.domain.metadata.SwapMetadata;
import com.txwatch.tracking.SortBy;
import com.txwatch.tracking.SortOptions;
import com.txwatch.tracking.TrackerDisposedException;
import com.txwatch.tracking.TransactionFilter;
import com.txwatch.tracking.TransactionTracker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@WebFluxTest(TransactionController.class)
class TransactionControllerTest {

    private static final Instant CREATED = Instant.parse("2025-03-01T12:00:00Z");

    @Autowired
    WebTestClient webTestClient;

    @MockBean
    TransactionTracker transactionTracker;

    private static TransactionEntry pendingSwap() {
        return TransactionEntry.pending("tx_abc", "5sig", TransactionType.SWAP, "Alice",
                new SwapMetadata("SOL", "USDC", new BigDecimal("1.5"), null), CREATED);
    }

    @Test
    @DisplayName("POST creates a PENDING entry with polymorphic metadata and returns 201")
    void addTransaction_returnsCreated() {
        when(transactionTracker.addTransaction(eq("5sig"), eq(TransactionType.SWAP), eq("Alice"), any()))
                .thenReturn(pendingSwap());

        webTestClient.post()
                .uri("/api/v1/transactions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {"signature":" 5sig ","type":"SWAP","from":"Alice",
                         "metadata":{"kind":"swap","inputToken":"SOL","outputToken":"USDC","inputAmount":1.5}}
                        """)
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.id").isEqualTo("tx_abc")
                .jsonPath("$.status").isEqualTo("PENDING")
                .jsonPath("$.metadata.kind").isEqualTo("swap");

        verify(transactionTracker).addTransaction("5sig", TransactionType.SWAP, "Alice",
                new SwapMetadata("SOL", "USDC", new BigDecimal("1.5"), null));
    }

    @Test
    void addTransaction_missingSignature_returns400() {
        webTestClient.post()
                .uri("/api/v1/transactions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"type\":\"SWAP\",\"from\":\"Alice\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_SIGNATURE")
                .jsonPath("$.message").isEqualTo("Transaction signature is required");

        verifyNoInteractions(transactionTracker);
    }

    @Test
    void addTransaction_unknownType_returns400() {
        webTestClient.post()
                .uri("/api/v1/transactions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"signature\":\"5sig\",\"type\":\"MINT\",\"from\":\"Alice\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_REQUEST");
    }

    @Test
    void addTransaction_metadataRejectedByTracker_returns400() {
        when(transactionTracker.addTransaction(any(), any(), any(), any()))
                .thenThrow(new IllegalArgumentException("StakeMetadata does not apply to SWAP transactions"));

        webTestClient.post()
                .uri("/api/v1/transactions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {"signature":"5sig","type":"SWAP","from":"Alice","metadata":{"kind":"stake","poolId":"p"}}
                        """)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").isEqualTo("StakeMetadata does not apply to SWAP transactions");
    }

    @Test
    void addTransaction_afterShutdown_returns503() {
        when(transactionTracker.addTransaction(any(), any(), any(), any()))
                .thenThrow(new TrackerDisposedException());

        webTestClient.post()
                .uri("/api/v1/transactions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"signature\":\"5sig\",\"type\":\"SWAP\",\"from\":\"Alice\"}")
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.error").isEqualTo("UNAVAILABLE");
    }

    @Test
    void addTransaction_unexpectedStateError_isNotReportedAsUnavailable() {
        when(transactionTracker.addTransaction(any(), any(), any(), any()))
                .thenThrow(new IllegalStateException("id generator broken"));

        webTestClient.post()
                .uri("/api/v1/transactions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"signature\":\"5sig\",\"type\":\"SWAP\",\"from\":\"Alice\"}")
                .exchange()
                .expectStatus().isEqualTo(500);
    }

    @Test
    @DisplayName("GET passes filter, sort and paging through to the tracker")
    void getHistory_mapsQueryParameters() {
        when(transactionTracker.getHistory(any(), any(), any(), any())).thenReturn(List.of(pendingSwap()));

        webTestClient.get()
                .uri("/api/v1/transactions?status=FAILED,EXPIRED&type=SWAP&address=Alice&minAmount=1"
                        + "&sortBy=AMOUNT&ascending=true&limit=5&offset=10")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(1)
                .jsonPath("$[0].signature").isEqualTo("5sig");

        ArgumentCaptor<TransactionFilter> filter = ArgumentCaptor.forClass(TransactionFilter.class);
        verify(transactionTracker).getHistory(filter.capture(), eq(new SortOptions(SortBy.AMOUNT, true)), eq(5), eq(10));
        assertThat(filter.getValue().statuses()).containsExactlyInAnyOrder(TransactionStatus.FAILED, TransactionStatus.EXPIRED);
        assertThat(filter.getValue().types()).containsExactly(TransactionType.SWAP);
        assertThat(filter.getValue().address()).isEqualTo("Alice");
        assertThat(filter.getValue().minAmount()).isEqualByComparingTo("1");
    }

    @Test
    void getHistory_defaultsToNewestFirstUnbounded() {
        when(transactionTracker.getHistory(any(), any(), any(), any())).thenReturn(List.of());

        webTestClient.get().uri("/api/v1/transactions").exchange().expectStatus().isOk();

        verify(transactionTracker).getHistory(any(TransactionFilter.class), eq(SortOptions.DEFAULT), isNull(), isNull());
    }

    @Test
    void getTransaction_unknownId_returns404() {
        when(transactionTracker.getTransaction("tx_missing")).thenReturn(Optional.empty());

        webTestClient.get()
                .uri("/api/v1/transactions/tx_missing")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("NOT_FOUND");
    }

    @Test
    void getTransaction_knownId_returnsEntry() {
        when(transactionTracker.getTransaction("tx_abc")).thenReturn(Optional.of(pendingSwap()));

        webTestClient.get()
                .uri("/api/v1/transactions/tx_abc")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.from").isEqualTo("Alice")
                .jsonPath("$.pending").doesNotExist();
    }

    @Test
    void export_returnsCsvAttachment() {
        when(transactionTracker.exportToCSV(any())).thenReturn("ID,Signature\n\"tx_abc\",\"5sig\"");

        webTestClient.get()
                .uri("/api/v1/transactions/export?status=CONFIRMED")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentTypeCompatibleWith("text/csv")
                .expectHeader().valueEquals("Content-Disposition", "attachment; filename=\"transactions.csv\"")
                .expectBody(String.class).isEqualTo("ID,Signature\n\"tx_abc\",\"5sig\"");
    }

    @Test
    void clearHistory_withCutoff_returnsRemovedCount() {
        when(transactionTracker.clearHistory(CREATED)).thenReturn(4);

        webTestClient.delete()
                .uri("/api/v1/transactions?olderThan=2025-03-01T12:00:00Z")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.removed").isEqualTo(4);
    }

    @Test
    void retryPending_reportsRearmedAndPending() {
        when(transactionTracker.retryPendingTransactions()).thenReturn(2);
        when(transactionTracker.pendingCount()).thenReturn(3L);

        webTestClient.post()
                .uri("/api/v1/transactions/retry-pending")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.rearmed").isEqualTo(2)
                .jsonPath("$.pending").isEqualTo(3);
    }
}
