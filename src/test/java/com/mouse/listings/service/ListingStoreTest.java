package com.mouse.listings.service;

import com.mongodb.bulk.BulkWriteError;
import com.mongodb.bulk.BulkWriteResult;
import com.mongodb.bulk.BulkWriteUpsert;
import com.mouse.listings.entity.ListingRecord;
import com.mouse.listings.exception.PartialWriteException;
import com.mouse.listings.exception.StoreUnavailableException;
import com.mouse.listings.model.KnownListingKeys;
import com.mouse.listings.model.StoreStats;
import com.mouse.listings.repository.ListingRecordRepository;
import org.bson.BsonString;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.BulkOperationException;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ListingStoreTest {

    @Mock
    private MongoTemplate mongoTemplate;

    @Mock
    private ListingRecordRepository repository;

    @Mock
    private BulkOperations bulkOperations;

    @Mock
    private BulkWriteResult bulkWriteResult;

    private ListingStore store;

    @BeforeEach
    void setUp() {
        store = new ListingStore(mongoTemplate, repository);
    }

    private static ListingRecord record(String externalId, String url, Instant scrapedAt, String price) {
        return ListingRecord.builder()
                .id(ListingRecord.keyOf(externalId, url))
                .externalId(externalId)
                .url(url)
                .askingPrice(price)
                .scrapedAt(scrapedAt)
                .build();
    }

    @Nested
    @DisplayName("findExistingKeys")
    class FindExistingKeys {

        @Test
        void findExistingKeys_singleQueryOnIdsAndUrls() {
            when(mongoTemplate.find(any(Query.class), eq(ListingRecord.class)))
                    .thenReturn(List.of(record("123", "https://x/123", null, null),
                            record(null, "https://x/old", null, null)));

            KnownListingKeys known = store.findExistingKeys(List.of("123", "456"), List.of("https://x/123", "https://x/old"));

            assertThat(known.externalIds()).containsExactly("123");
            assertThat(known.urls()).containsExactlyInAnyOrder("https://x/123", "https://x/old");

            ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
            verify(mongoTemplate, times(1)).find(query.capture(), eq(ListingRecord.class));
            Document criteria = query.getValue().getQueryObject();
            assertThat(criteria.toJson()).contains("$or", "externalId", "url", "$in");
        }

        @Test
        void findExistingKeys_nothingToLookUp_skipsQuery() {
            KnownListingKeys known = store.findExistingKeys(List.of(), List.of());

            assertThat(known.externalIds()).isEmpty();
            verifyNoInteractions(mongoTemplate);
        }

        @Test
        void findExistingKeys_storeDown_throwsStoreUnavailable() {
            when(mongoTemplate.find(any(Query.class), eq(ListingRecord.class)))
                    .thenThrow(new DataAccessResourceFailureException("connection refused"));

            assertThatThrownBy(() -> store.findExistingKeys(List.of("1"), List.of("https://x/1")))
                    .isInstanceOf(StoreUnavailableException.class)
                    .hasCauseInstanceOf(DataAccessResourceFailureException.class);
        }
    }

    @Nested
    @DisplayName("upsertAll")
    class UpsertAll {

        @Test
        void upsertAll_unorderedBulkUpsertByKey_countsInsertedPlusModified() {
            when(mongoTemplate.bulkOps(BulkOperations.BulkMode.UNORDERED, ListingRecord.class)).thenReturn(bulkOperations);
            when(bulkOperations.execute()).thenReturn(bulkWriteResult);
            when(bulkWriteResult.getUpserts()).thenReturn(List.of(new BulkWriteUpsert(0, new BsonString("123"))));
            when(bulkWriteResult.getModifiedCount()).thenReturn(1);

            int count = store.upsertAll(List.of(
                    record("123", "https://x/123", Instant.now(), "500000"),
                    record(null, "https://x/no-id", Instant.now(), "100")));

            assertThat(count).isEqualTo(2);
            ArgumentCaptor<Query> queries = ArgumentCaptor.forClass(Query.class);
            verify(bulkOperations, times(2)).upsert(queries.capture(), any(Update.class));
            assertThat(queries.getAllValues())
                    .extracting(q -> q.getQueryObject().get("_id"))
                    .containsExactly("123", "https://x/no-id");
        }

        @Test
        void upsertAll_sameKeyTwice_keepsLatestScrape() {
            Instant earlier = Instant.parse("2024-05-01T10:00:00Z");
            Instant later = Instant.parse("2024-05-01T22:00:00Z");
            when(mongoTemplate.bulkOps(BulkOperations.BulkMode.UNORDERED, ListingRecord.class)).thenReturn(bulkOperations);
            when(bulkOperations.execute()).thenReturn(bulkWriteResult);
            when(bulkWriteResult.getUpserts()).thenReturn(List.of());
            when(bulkWriteResult.getModifiedCount()).thenReturn(1);

            int count = store.upsertAll(List.of(
                    record("123", "https://x/123", later, "450000"),
                    record("123", "https://x/123", earlier, "500000")));

            assertThat(count).isEqualTo(1);
            ArgumentCaptor<Update> updates = ArgumentCaptor.forClass(Update.class);
            verify(bulkOperations, times(1)).upsert(any(Query.class), updates.capture());
            Document set = (Document) updates.getValue().getUpdateObject().get("$set");
            assertThat(set.get("askingPrice")).isEqualTo("450000");
            assertThat(set.get("scrapedAt")).isEqualTo(later);
        }

        @Test
        void upsertAll_empty_doesNotTouchStore() {
            assertThat(store.upsertAll(List.of())).isZero();
            verifyNoInteractions(mongoTemplate);
        }

        @Test
        void upsertAll_writeFails_throwsStoreUnavailable() {
            when(mongoTemplate.bulkOps(BulkOperations.BulkMode.UNORDERED, ListingRecord.class)).thenReturn(bulkOperations);
            when(bulkOperations.execute()).thenThrow(new DataAccessResourceFailureException("timeout"));

            assertThatThrownBy(() -> store.upsertAll(List.of(record("1", "https://x/1", Instant.now(), "1"))))
                    .isInstanceOf(StoreUnavailableException.class);
        }

        @Test
        void upsertAll_partialWrite_reportsWrittenAndRejectedCounts() {
            BulkOperationException partial = mock(BulkOperationException.class);
            when(partial.getResult()).thenReturn(bulkWriteResult);
            when(partial.getErrors()).thenReturn(List.of(mock(BulkWriteError.class)));
            when(bulkWriteResult.getUpserts()).thenReturn(List.of(
                    new BulkWriteUpsert(0, new BsonString("1")),
                    new BulkWriteUpsert(1, new BsonString("2"))));
            when(bulkWriteResult.getModifiedCount()).thenReturn(1);
            when(mongoTemplate.bulkOps(BulkOperations.BulkMode.UNORDERED, ListingRecord.class)).thenReturn(bulkOperations);
            when(bulkOperations.execute()).thenThrow(partial);

            assertThatThrownBy(() -> store.upsertAll(List.of(
                    record("1", "https://x/1", Instant.now(), "1"),
                    record("2", "https://x/2", Instant.now(), "2"),
                    record("3", "https://x/3", Instant.now(), "3"),
                    record("4", "https://x/4", Instant.now(), "4"))))
                    .isInstanceOfSatisfying(PartialWriteException.class, e -> {
                        assertThat(e.getPersisted()).isEqualTo(3);
                        assertThat(e.getRejected()).isEqualTo(1);
                        assertThat(e).isInstanceOf(StoreUnavailableException.class);
                    });
        }
    }

    @Test
    void latestPerKey_collapsesByKeyKeepingFirstSeenOrder() {
        Instant t1 = Instant.parse("2024-05-01T10:00:00Z");
        Instant t2 = Instant.parse("2024-05-02T10:00:00Z");

        Collection<ListingRecord> latest = ListingStore.latestPerKey(List.of(
                record("1", "https://x/1", t1, "a"),
                record("2", "https://x/2", t1, "b"),
                record("1", "https://x/1", t2, "c")));

        assertThat(latest).extracting(ListingRecord::getAskingPrice).containsExactly("c", "b");
    }

    @Test
    void stats_countAndLatest() {
        ListingRecord newest = record("9", "https://x/9", Instant.now(), "1");
        when(repository.count()).thenReturn(42L);
        when(repository.findAllByOrderByScrapedAtDesc(any(Pageable.class))).thenReturn(List.of(newest));

        StoreStats stats = store.stats(3);

        assertThat(stats.totalListings()).isEqualTo(42L);
        assertThat(stats.latest()).containsExactly(newest);
        ArgumentCaptor<Pageable> page = ArgumentCaptor.forClass(Pageable.class);
        verify(repository).findAllByOrderByScrapedAtDesc(page.capture());
        assertThat(page.getValue().getPageSize()).isEqualTo(3);
    }

    @Test
    void knownKeys_containsByIdOrUrl() {
        KnownListingKeys keys = new KnownListingKeys(Set.of("1"), Set.of("https://x/2"));

        assertThat(keys.contains(new com.mouse.listings.model.ListingCandidate("t", "https://x/1", "1", Instant.now()))).isTrue();
        assertThat(keys.contains(new com.mouse.listings.model.ListingCandidate("t", "https://x/2", "2", Instant.now()))).isTrue();
        assertThat(keys.contains(new com.mouse.listings.model.ListingCandidate("t", "https://x/3", "3", Instant.now()))).isFalse();
    }
}
