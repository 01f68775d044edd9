package com.mouse.listings.repository;

import com.mouse.listings.entity.ListingRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ListingRecordRepository extends MongoRepository<ListingRecord, String> {

    List<ListingRecord> findAllByOrderByScrapedAtDesc(Pageable pageable);
}
