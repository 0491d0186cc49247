package com.library.borrowing.integration;

import com.library.borrowing.dto.response.RequestSubmittedResponse;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

class BorrowRequestConcurrencyTest extends AbstractIntegrationTest {

    @Test
    void concurrentApprovalsOfOverlappingRequests_onlyOneSucceeds() throws Exception {
        int requestCount = 5;
        Long bookId = createBook("Concurrent Approval Book", requestCount);
        TestUser reader = createUser("reader");

        List<Long> requestIds = new ArrayList<>();
        for (int i = 0; i < requestCount; i++) {
            requestIds.add(submit(reader, bookId, "2024-03-01", "2024-03-0" + (i + 2),
                RequestSubmittedResponse.class).getBody().requestId());
        }

        ExecutorService executor = Executors.newFixedThreadPool(requestCount);
        CountDownLatch startLatch = new CountDownLatch(1);
        List<Future<ResponseEntity<String>>> futures = new ArrayList<>();

        for (Long requestId : requestIds) {
            futures.add(executor.submit(() -> {
                startLatch.await();
                return process(requestId, "approve", String.class);
            }));
        }

        startLatch.countDown();

        List<HttpStatus> statuses = new ArrayList<>();
        for (Future<ResponseEntity<String>> future : futures) {
            statuses.add((HttpStatus) future.get().getStatusCode());
        }

        executor.shutdown();

        assertThat(statuses).filteredOn(s -> s == HttpStatus.OK).hasSize(1);
        assertThat(statuses).filteredOn(s -> s == HttpStatus.BAD_REQUEST).hasSize(requestCount - 1);

        Integer approved = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM borrow_requests WHERE book_id = ? AND status = 'APPROVED'",
            Integer.class, bookId);
        assertThat(approved).isEqualTo(1);
        assertThat(copiesOf(bookId)).isEqualTo(requestCount - 1);
    }
}
