package com.mouse.listings.service;

import com.mongodb.bulk.BulkWriteResult;
import com.mouse.listings.entity.ListingRecord;
import com.mouse.listings.exception.PartialWriteException;
import com.mouse.listings.exception.StoreUnavailableException;
import com.mouse.listings.model.KnownListingKeys;
import com.mouse.listings.model.StoreStats;
import com.mouse.listings.repository.ListingRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.mongodb.BulkOperationException;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Listing persistence on MongoDB. Documents are keyed by listing key and written
 * with upserts, so storing the same listing again overwrites it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ListingStore {

    private final MongoTemplate mongoTemplate;
    private final ListingRecordRepository repository;

    /**
     * One round-trip lookup of which of the given ids and urls are already stored.
     */
    public KnownListingKeys findExistingKeys(Collection<String> externalIds, Collection<String> urls) {
        List<String> ids = externalIds.stream().filter(Objects::nonNull).distinct().toList();
        List<String> links = urls.stream().filter(Objects::nonNull).distinct().toList();
        if (ids.isEmpty() && links.isEmpty()) {
            return KnownListingKeys.none();
        }

        Query query = new Query(new Criteria().orOperator(
                Criteria.where("externalId").in(ids),
                Criteria.where("url").in(links)));
        query.fields().include("externalId").include("url");

        List<ListingRecord> found;
        try {
            found = mongoTemplate.find(query, ListingRecord.class);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Freshness lookup failed", e);
        }

        Set<String> knownIds = new HashSet<>();
        Set<String> knownUrls = new HashSet<>();
        for (ListingRecord record : found) {
            if (record.getExternalId() != null) knownIds.add(record.getExternalId());
            if (record.getUrl() != null) knownUrls.add(record.getUrl());
        }
        log.info("Freshness lookup | Ids: {} | Urls: {} | Known: {}", ids.size(), links.size(), found.size());
        return new KnownListingKeys(knownIds, knownUrls);
    }

    /**
     * Unordered bulk upsert by listing key.
     *
     * @return inserted plus modified documents
     * @throws PartialWriteException when only part of the batch was written
     */
    public int upsertAll(Collection<ListingRecord> records) {
        if (records == null || records.isEmpty()) {
            return 0;
        }

        Collection<ListingRecord> latest = latestPerKey(records);
        BulkOperations ops = mongoTemplate.bulkOps(BulkOperations.BulkMode.UNORDERED, ListingRecord.class);
        for (ListingRecord record : latest) {
            ops.upsert(Query.query(Criteria.where("_id").is(record.key())), toUpdate(record));
        }

        try {
            BulkWriteResult result = ops.execute();
            int count = writtenCount(result);
            log.info("Listings persisted | Batch: {} | Inserted: {} | Modified: {}",
                    latest.size(), result.getUpserts().size(), result.getModifiedCount());
            return count;
        } catch (BulkOperationException e) {
            int written = e.getResult() != null ? writtenCount(e.getResult()) : 0;
            int rejected = e.getErrors() != null ? e.getErrors().size() : 0;
            log.error("Bulk upsert partially failed | Batch: {} | Written: {} | Rejected: {}",
                    latest.size(), written, rejected);
            throw new PartialWriteException("Bulk upsert of " + latest.size() + " listings wrote " + written
                    + " and rejected " + rejected, written, rejected, e);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Bulk upsert of " + latest.size() + " listings failed", e);
        }
    }

    private static int writtenCount(BulkWriteResult result) {
        return result.getUpserts().size() + result.getModifiedCount();
    }

    public StoreStats stats(int latestLimit) {
        try {
            long total = repository.count();
            List<ListingRecord> latest = latestLimit > 0
                    ? repository.findAllByOrderByScrapedAtDesc(PageRequest.of(0, latestLimit))
                    : List.of();
            return new StoreStats(total, latest);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Could not read store statistics", e);
        }
    }

    static Collection<ListingRecord> latestPerKey(Collection<ListingRecord> records) {
        Map<String, ListingRecord> byKey = new LinkedHashMap<>();
        for (ListingRecord record : records) {
            byKey.merge(record.key(), record, (existing, candidate) -> isLater(candidate, existing) ? candidate : existing);
        }
        return new ArrayList<>(byKey.values());
    }

    private static boolean isLater(ListingRecord candidate, ListingRecord existing) {
        if (candidate.getScrapedAt() == null) return false;
        if (existing.getScrapedAt() == null) return true;
        return !candidate.getScrapedAt().isBefore(existing.getScrapedAt());
    }

    private static Update toUpdate(ListingRecord record) {
        return new Update()
                .set("externalId", record.getExternalId())
                .set("url", record.getUrl())
                .set("title", record.getTitle())
                .set("askingPrice", record.getAskingPrice())
                .set("grossRevenue", record.getGrossRevenue())
                .set("established", record.getEstablished())
                .set("cashflow", record.getCashflow())
                .set("description", record.getDescription())
                .set("category", record.getCategory())
                .set("originalCategory", record.getOriginalCategory())
                .set("location", record.getLocation())
                .set("city", record.getCity())
                .set("state", record.getState())
                .set("brokerName", record.getBrokerName())
                .set("brokerProfileUrl", record.getBrokerProfileUrl())
                .set("brokerPhone", record.getBrokerPhone())
                .set("scrapedAt", record.getScrapedAt());
    }
}
