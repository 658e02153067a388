package com.example.baselinediff.repository;

import com.example.baselinediff.entity.Classification;
import com.example.baselinediff.entity.CommitLabelLink;
import com.example.baselinediff.entity.CommitRecord;
import com.example.baselinediff.entity.Label;
import com.example.baselinediff.entity.ProjectRecord;
import com.example.baselinediff.repository.query.CommitPredicates;
import com.example.baselinediff.repository.support.BatchQueryPlanner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Native commit store operations against REAL PostgreSQL.
 *
 * The planner ceiling is 3 here, so every list-bound statement is split
 * into several chunks and inserts run one row per statement.
 */
@DataJpaTest(excludeAutoConfiguration = {FlywayAutoConfiguration.class})
@Testcontainers(disabledWithoutDocker = true)
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class CommitRecordRepositoryIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("testdb")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create-drop");
    }

    @TestConfiguration
    static class SmallBatchConfig {
        @Bean
        BatchQueryPlanner batchQueryPlanner() {
            return new BatchQueryPlanner(3);
        }
    }

    @Autowired
    private CommitRecordRepository commitRecordRepository;

    @Autowired
    private ProjectRecordRepository projectRecordRepository;

    @Autowired
    private LabelRepository labelRepository;

    @Autowired
    private CommitLabelLinkRepository commitLabelLinkRepository;

    @BeforeEach
    void setUp() {
        commitLabelLinkRepository.deleteAllLinks();
        commitRecordRepository.deleteAllCommits();
        projectRecordRepository.deleteAllProjects();
    }

    /**
     * TEST 1: INSERT IDEMPOTENCY
     *
     * Scenario: same batch ingested twice, second batch also carries a changed subject
     * Expected: stored row unchanged, second run inserts nothing
     */
    @Test
    void insertIgnoringDuplicates_StoredRowWins() {
        // GIVEN
        List<CommitRecord> batch = List.of(
                commit("core", hash(1), "I1", "2024-01-01T00:00:00Z", "original"),
                commit("core", hash(2), "I2", "2024-01-02T00:00:00Z", "second"),
                commit("core", hash(3), null, null, "third"));

        // WHEN
        int first = commitRecordRepository.insertIgnoringDuplicates(batch);
        int again = commitRecordRepository.insertIgnoringDuplicates(List.of(
                commit("core", hash(1), "I1", "2024-01-01T00:00:00Z", "rewritten"),
                commit("core", hash(4), "I4", "2024-01-04T00:00:00Z", "fourth")));

        // THEN
        assertThat(first).isEqualTo(3);
        assertThat(again).as("only the new hash is inserted").isEqualTo(1);
        assertThat(commitRecordRepository.count()).isEqualTo(4);
        assertThat(commitRecordRepository.findByContentHash(hash(1)))
                .get().extracting(CommitRecord::getSubject).isEqualTo("original");
        assertThat(commitRecordRepository.findByContentHash(hash(3)))
                .get().extracting(CommitRecord::getTimestamp).isNull();
    }

    /**
     * TEST 2: CHUNKED CLASSIFICATION WRITE-BACK
     *
     * Scenario: ten identifiers written back with a ceiling of three per statement
     * Expected: every row labeled, affected counts summed across chunks
     */
    @Test
    void classifyByChangeIds_SpansChunks() {
        List<CommitRecord> records = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            records.add(commit("up/core", hash(100 + i), "I" + i, "2024-01-01T00:00:00Z", "up " + i));
            records.add(commit("vendor/core", hash(200 + i), "I" + i, "2024-01-01T00:00:00Z", "vendor " + i));
        }
        commitRecordRepository.insertIgnoringDuplicates(records);
        Set<String> ids = IntStream.range(0, 10).mapToObj(i -> "I" + i).collect(Collectors.toSet());

        assertThat(commitRecordRepository.findDistinctChangeIds(List.of("up/core"))).isEqualTo(ids);

        int labeled = commitRecordRepository.classifyByChangeIds(Classification.SHARED, ids);

        assertThat(labeled).isEqualTo(20);
        assertThat(commitRecordRepository.countByClassification(Classification.SHARED)).isEqualTo(20);

        assertThat(commitRecordRepository.clearClassifications()).isEqualTo(20);
        assertThat(commitRecordRepository.countByClassificationIsNull()).isEqualTo(20);
    }

    /**
     * TEST 3: IDENTIFIER-LESS COMMITS
     *
     * Expected: labeled by project membership, leftovers fall back to shared
     */
    @Test
    void classifyUnidentified_UsesProjectMembership() {
        commitRecordRepository.insertIgnoringDuplicates(List.of(
                commit("up/only", hash(1), null, null, "a"),
                commit("vendor/only", hash(2), "", null, "b"),
                commit("unclaimed", hash(3), null, null, "c"),
                commit("up/only", hash(4), "I9", null, "d")));

        commitRecordRepository.classifyUnidentified(Classification.UPSTREAM_ONLY, List.of("up/only"));
        commitRecordRepository.classifyUnidentified(Classification.VENDOR_ONLY, List.of("vendor/only"));
        commitRecordRepository.classifyRemainingUnidentified(Classification.SHARED);

        assertThat(classificationOf(hash(1))).isEqualTo(Classification.UPSTREAM_ONLY);
        assertThat(classificationOf(hash(2))).isEqualTo(Classification.VENDOR_ONLY);
        assertThat(classificationOf(hash(3))).isEqualTo(Classification.SHARED);
        assertThat(classificationOf(hash(4))).as("identified commits are untouched").isNull();
    }

    /**
     * TEST 4: PAGE ORDER AND FILTERS
     *
     * Expected: newest first, missing timestamps last, remote URL joined from projects
     */
    @Test
    void findPage_OrdersNewestFirst_AndJoinsRemote() {
        projectRecordRepository.upsertAll(List.of(
                ProjectRecord.builder().project("core").remoteUrl("https://old.example.com").path("core").build(),
                ProjectRecord.builder().project("core").remoteUrl("https://git.example.com").path("core").build()));
        commitRecordRepository.insertIgnoringDuplicates(List.of(
                commit("core", hash(1), "I1", "2024-01-01T00:00:00Z", "Old fix"),
                commit("core", hash(2), "I2", null, "Undated"),
                commit("core", hash(3), "I3", "2024-03-01T00:00:00Z", "New FIX"),
                commit("other", hash(4), "I4", "2024-02-01T00:00:00Z", "Unrelated")));

        List<CommitRow> all = commitRecordRepository.findPage(List.of(), 10, 0);
        assertThat(all).extracting(CommitRow::getContentHash)
                .containsExactly(hash(3), hash(4), hash(1), hash(2));
        assertThat(all.get(0).getRemoteUrl()).as("last upsert wins").isEqualTo("https://git.example.com");
        assertThat(all.get(1).getRemoteUrl()).isNull();

        List<CommitRow> fixes = commitRecordRepository.findPage(
                List.of(CommitPredicates.project("core"), CommitPredicates.search("fix")), 1, 1);
        assertThat(fixes).extracting(CommitRow::getContentHash).containsExactly(hash(1));
        assertThat(commitRecordRepository.countMatching(
                List.of(CommitPredicates.project("core"), CommitPredicates.search("fix")))).isEqualTo(2);
    }

    /**
     * TEST 5: RELATED COMMITS PER IDENTIFIER
     *
     * Expected: at most perIdentifier rows per identifier, lowest content hashes first
     */
    @Test
    void findByChangeIds_LimitsRowsPerIdentifier() {
        List<CommitRecord> records = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            records.add(commit("p" + i, hash(10 + i), "Ishared", null, "s" + i));
        }
        records.add(commit("solo", hash(50), "Isolo", null, "solo"));
        commitRecordRepository.insertIgnoringDuplicates(records);

        List<CommitRow> related = commitRecordRepository.findByChangeIds(List.of("Ishared", "Isolo"), 3);

        assertThat(related).extracting(CommitRow::getContentHash)
                .containsExactly(hash(10), hash(11), hash(12), hash(50));
    }

    /**
     * TEST 6: LABELS OF A PAGE
     */
    @Test
    void findLabels_ReturnsLinksOfRequestedHashes() {
        commitRecordRepository.insertIgnoringDuplicates(List.of(
                commit("core", hash(1), "I1", null, "a"),
                commit("core", hash(2), "I2", null, "b")));
        Label security = labelRepository.save(Label.builder().name("Security").build());
        Label backport = labelRepository.save(Label.builder().name("Backport").build());
        commitLabelLinkRepository.save(new CommitLabelLink(hash(1), security.getId()));
        commitLabelLinkRepository.save(new CommitLabelLink(hash(1), backport.getId()));
        commitLabelLinkRepository.save(new CommitLabelLink(hash(2), security.getId()));
        commitLabelLinkRepository.flush();

        List<LabelRef> labels = commitRecordRepository.findLabels(List.of(hash(1)));

        assertThat(labels).extracting(LabelRef::name).containsExactly("Backport", "Security");
        assertThat(labels).allMatch(ref -> ref.commitHash().equals(hash(1)));
    }

    private Classification classificationOf(String hash) {
        return commitRecordRepository.findByContentHash(hash).orElseThrow().getClassification();
    }

    private static String hash(int n) {
        return String.format("%040x", n);
    }

    private static CommitRecord commit(String project, String hash, String changeId, String timestamp,
                                       String subject) {
        return CommitRecord.builder()
                .project(project)
                .contentHash(hash)
                .changeIdentifier(changeId)
                .author("Alice")
                .timestamp(timestamp)
                .subject(subject)
                .body("")
                .build();
    }
}
