package com.mouse.listings.service;

import com.mouse.listings.exception.StoreUnavailableException;
import com.mouse.listings.model.KnownListingKeys;
import com.mouse.listings.model.ListingCandidate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FreshnessFilterTest {

    @Mock
    private ListingStore listingStore;

    private FreshnessFilter filter;

    @BeforeEach
    void setUp() {
        filter = new FreshnessFilter(listingStore);
    }

    private static ListingCandidate candidate(String id, String url) {
        return new ListingCandidate("t-" + url, url, id, Instant.now());
    }

    @Test
    void filter_removesCandidatesKnownByIdOrUrl_inOneLookup() {
        ListingCandidate known = candidate("123", "https://x/123");
        ListingCandidate knownByUrl = candidate(null, "https://x/old");
        ListingCandidate fresh = candidate("456", "https://x/456");
        when(listingStore.findExistingKeys(anyCollection(), anyCollection()))
                .thenReturn(new KnownListingKeys(Set.of("123"), Set.of("https://x/old")));

        List<ListingCandidate> result = filter.filter(List.of(known, knownByUrl, fresh));

        assertThat(result).containsExactly(fresh);
        verify(listingStore, times(1)).findExistingKeys(anyCollection(), anyCollection());
    }

    @Test
    @SuppressWarnings("unchecked")
    void filter_duplicateKeysCollapse_andBlankIdsAreNotQueried() {
        ListingCandidate first = candidate("123", "https://x/123");
        ListingCandidate duplicate = candidate("123", "https://x/123?ref=2");
        ListingCandidate noId = candidate(" ", "https://x/no-id");
        when(listingStore.findExistingKeys(anyCollection(), anyCollection())).thenReturn(KnownListingKeys.none());

        List<ListingCandidate> result = filter.filter(List.of(first, duplicate, noId));

        assertThat(result).containsExactly(first, noId);
        ArgumentCaptor<Collection<String>> ids = ArgumentCaptor.forClass(Collection.class);
        ArgumentCaptor<Collection<String>> urls = ArgumentCaptor.forClass(Collection.class);
        verify(listingStore).findExistingKeys(ids.capture(), urls.capture());
        assertThat(ids.getValue()).containsExactly("123");
        assertThat(urls.getValue()).containsExactly("https://x/123", "https://x/no-id");
    }

    @Test
    void filter_emptyInput_skipsStore() {
        assertThat(filter.filter(List.of())).isEmpty();
        verifyNoInteractions(listingStore);
    }

    @Test
    void filter_storeUnavailable_propagates() {
        when(listingStore.findExistingKeys(any(), any())).thenThrow(new StoreUnavailableException("down"));

        assertThatThrownBy(() -> filter.filter(List.of(candidate("1", "https://x/1"))))
                .isInstanceOf(StoreUnavailableException.class);
    }

    @Test
    void filter_equalsSetDifferenceOnKeys() {
        List<ListingCandidate> candidates = List.of(
                candidate("1", "https://x/1"),
                candidate("2", "https://x/2"),
                candidate(null, "https://x/3"),
                candidate("4", "https://x/4"));
        Set<String> storedIds = Set.of("2", "4");
        when(listingStore.findExistingKeys(anyCollection(), anyCollection()))
                .thenReturn(new KnownListingKeys(storedIds, Set.of()));

        List<ListingCandidate> result = filter.filter(candidates);

        assertThat(result).extracting(ListingCandidate::key).containsExactly("1", "https://x/3");
    }
}
