package com.example.baselinediff.service;

import com.example.baselinediff.config.BaselineProperties;
import com.example.baselinediff.dto.request.CommitSearchRequest;
import com.example.baselinediff.dto.response.CommitPageResponse;
import com.example.baselinediff.dto.response.CommitResponse;
import com.example.baselinediff.entity.Classification;
import com.example.baselinediff.exception.BadRequestException;
import com.example.baselinediff.exception.LimitExceededException;
import com.example.baselinediff.repository.CommitRecordRepository;
import com.example.baselinediff.repository.CommitRow;
import com.example.baselinediff.repository.LabelRef;
import com.example.baselinediff.repository.query.CommitPredicate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CommitQueryServiceTest {

    @Mock
    private CommitRecordRepository commitRecordRepository;

    private BaselineProperties properties;
    private CommitQueryService service;

    @BeforeEach
    void setUp() {
        properties = new BaselineProperties();
        service = new CommitQueryService(commitRecordRepository, properties);
    }

    @Test
    void resolveWindow_AppliesDefaultAndMaxPageSize() {
        assertThat(service.resolveWindow(new CommitSearchRequest()))
                .isEqualTo(new CommitQueryService.PageWindow(100, 0, false));
        assertThat(service.resolveWindow(CommitSearchRequest.builder().limit(1000).offset(20).build()))
                .isEqualTo(new CommitQueryService.PageWindow(1000, 20, false));

        assertThatThrownBy(() -> service.resolveWindow(CommitSearchRequest.builder().limit(1001).build()))
                .isInstanceOf(LimitExceededException.class);
    }

    @Test
    void resolveWindow_RejectsNegativePaging() {
        assertThatThrownBy(() -> service.resolveWindow(CommitSearchRequest.builder().limit(-1).build()))
                .isInstanceOf(BadRequestException.class)
                .extracting("code").isEqualTo("INVALID_PAGING");
        assertThatThrownBy(() -> service.resolveWindow(CommitSearchRequest.builder().offset(-5).build()))
                .isInstanceOf(BadRequestException.class);
    }

    @Test
    void resolveWindow_UnboundedIsCappedAtCeiling() {
        assertThat(service.resolveWindow(CommitSearchRequest.builder().unbounded(true).build()))
                .isEqualTo(new CommitQueryService.PageWindow(50_000, 0, true));
        assertThat(service.resolveWindow(CommitSearchRequest.builder().unbounded(true).limit(5000).build()))
                .isEqualTo(new CommitQueryService.PageWindow(5000, 0, false));
    }

    @Test
    void search_UnboundedBeyondCeiling_IsMarkedTruncated() {
        properties.getQuery().setUnboundedCeiling(2);
        when(commitRecordRepository.countMatching(anyList())).thenReturn(3L);
        when(commitRecordRepository.findPage(anyList(), eq(2), eq(0)))
                .thenReturn(List.of(row("a", "core", null, Classification.VENDOR_ONLY),
                        row("b", "core", null, Classification.VENDOR_ONLY)));

        CommitPageResponse page = service.search(CommitSearchRequest.builder().unbounded(true).build());

        assertThat(page.getTotal()).isEqualTo(3);
        assertThat(page.getCommits()).hasSize(2);
        assertThat(page.isTruncated()).isTrue();
    }

    @Test
    void search_LimitZero_ReturnsTotalOnly() {
        when(commitRecordRepository.countMatching(anyList())).thenReturn(42L);

        CommitPageResponse page = service.search(CommitSearchRequest.builder().limit(0).build());

        assertThat(page.getTotal()).isEqualTo(42);
        assertThat(page.getCommits()).isEmpty();
        verify(commitRecordRepository, never()).findPage(anyList(), anyInt(), anyInt());
    }

    @Test
    void search_SharedRowsGetRelatedCommits_ExcludingThemselves() {
        // GIVEN: shared commit in upstream with two counterparts in vendor projects
        CommitRow upstream = row("aaa", "up/core", "I1", Classification.SHARED);
        CommitRow vendorA = row("bbb", "vendor/core", "I1", Classification.SHARED);
        CommitRow vendorB = row("ccc", "vendor/extra", "I1", Classification.SHARED);
        when(commitRecordRepository.countMatching(anyList())).thenReturn(1L);
        when(commitRecordRepository.findPage(anyList(), anyInt(), anyInt())).thenReturn(List.of(upstream));
        when(commitRecordRepository.findLabels(List.of("aaa"))).thenReturn(List.of(new LabelRef("aaa", 3L, "Security")));
        when(commitRecordRepository.findByChangeIds(Set.of("I1"), 6)).thenReturn(List.of(upstream, vendorA, vendorB));

        // WHEN
        CommitPageResponse page = service.search(CommitSearchRequest.builder()
                .classification("shared").build());

        // THEN
        CommitResponse commit = page.getCommits().get(0);
        assertThat(commit.getRelatedCommits())
                .extracting("hash")
                .containsExactly("bbb", "ccc");
        assertThat(commit.getRelatedCommits().get(0).getUrl())
                .isEqualTo("https://git.example.com/vendor/core/commit/bbb");
        assertThat(commit.getLabels()).extracting("name").containsExactly("Security");
        assertThat(commit.getUrl()).isEqualTo("https://git.example.com/up/core/commit/aaa");
    }

    @Test
    void search_ExclusiveRows_HaveNoRelatedCommits() {
        when(commitRecordRepository.countMatching(anyList())).thenReturn(1L);
        when(commitRecordRepository.findPage(anyList(), anyInt(), anyInt()))
                .thenReturn(List.of(row("aaa", "up/core", "I9", Classification.UPSTREAM_ONLY)));

        CommitPageResponse page = service.search(new CommitSearchRequest());

        assertThat(page.getCommits().get(0).getRelatedCommits()).isEmpty();
        verify(commitRecordRepository, never()).findByChangeIds(anyCollection(), anyInt());
    }

    @Test
    void toPredicates_BuildsOnePredicatePerFilter() {
        List<CommitPredicate> predicates = service.toPredicates(CommitSearchRequest.builder()
                .classification("vendor_only")
                .project("vendor/core")
                .author("bob")
                .search("fix")
                .dateFrom(LocalDate.of(2024, 1, 1))
                .labelId(1L)
                .build());

        assertThat(predicates).extracting(CommitPredicate::kind).containsExactly(
                CommitPredicate.Kind.CLASSIFICATION, CommitPredicate.Kind.PROJECT, CommitPredicate.Kind.AUTHOR,
                CommitPredicate.Kind.SEARCH, CommitPredicate.Kind.DATE_RANGE, CommitPredicate.Kind.LABEL);
    }

    @Test
    void toPredicates_RejectsInvertedDateRange_AndUnknownClassification() {
        assertThatThrownBy(() -> service.toPredicates(CommitSearchRequest.builder()
                .dateFrom(LocalDate.of(2024, 2, 1))
                .dateTo(LocalDate.of(2024, 1, 1))
                .build()))
                .isInstanceOf(BadRequestException.class)
                .extracting("code").isEqualTo("INVALID_DATE_RANGE");
        assertThatThrownBy(() -> service.toPredicates(CommitSearchRequest.builder().classification("both").build()))
                .isInstanceOf(BadRequestException.class)
                .extracting("code").isEqualTo("INVALID_CLASSIFICATION");
    }

    private static CommitRow row(String hash, String project, String changeId, Classification classification) {
        return CommitRow.builder()
                .project(project)
                .contentHash(hash)
                .changeIdentifier(changeId)
                .author("Alice")
                .timestamp("2024-01-01T00:00:00Z")
                .subject("subject " + hash)
                .body("")
                .classification(classification)
                .remoteUrl("https://git.example.com")
                .build();
    }
}
