package com.example.baselinediff.service;

import com.example.baselinediff.client.git.RawCommit;
import com.example.baselinediff.dto.request.CommitInput;
import com.example.baselinediff.entity.CommitRecord;
import com.example.baselinediff.exception.MalformedInputException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommitRecordMapperTest {

    private static final String SHA1 = "0123456789ABCDEF0123456789abcdef01234567";

    private final CommitRecordMapper mapper = new CommitRecordMapper();

    @Test
    void toEntity_NormalizesFields() {
        CommitInput input = CommitInput.builder()
                .project(" platform/build ")
                .hash(SHA1)
                .changeId("  ")
                .author("Alice")
                .date("2024-03-01T10:15:30+08:00")
                .reviewUrl("")
                .build();

        CommitRecord record = mapper.toEntity(input);

        assertThat(record.getProject()).isEqualTo("platform/build");
        assertThat(record.getContentHash()).isEqualTo(SHA1.toLowerCase());
        assertThat(record.getChangeIdentifier()).isNull();
        assertThat(record.getTimestamp()).isEqualTo("2024-03-01T02:15:30Z");
        assertThat(record.getSubject()).isEmpty();
        assertThat(record.getBody()).isEmpty();
        assertThat(record.getReviewUrl()).isNull();
        assertThat(record.getClassification()).isNull();
    }

    @Test
    void toEntity_FromRawCommit_KeepsTrailers() {
        RawCommit raw = RawCommit.builder()
                .project("core")
                .contentHash("a".repeat(64))
                .changeIdentifier("I1")
                .timestamp("2024-01-01T00:00:00Z")
                .subject("s")
                .body("b")
                .reviewUrl("https://review.example.com/1")
                .build();

        CommitRecord record = mapper.toEntity(raw);

        assertThat(record.getChangeIdentifier()).isEqualTo("I1");
        assertThat(record.getReviewUrl()).isEqualTo("https://review.example.com/1");
        assertThat(record.getTimestamp()).isEqualTo("2024-01-01T00:00:00Z");
    }

    @Test
    void missingProjectOrHash_IsMalformed() {
        assertThatThrownBy(() -> mapper.toEntity(CommitInput.builder().hash(SHA1).build()))
                .isInstanceOf(MalformedInputException.class)
                .hasMessageContaining("project");
        assertThatThrownBy(() -> mapper.toEntity(CommitInput.builder().project("p").build()))
                .isInstanceOf(MalformedInputException.class)
                .hasMessageContaining("hash");
    }

    @Test
    void invalidHash_IsMalformed() {
        assertThatThrownBy(() -> CommitRecordMapper.normalizeHash("xyz"))
                .isInstanceOf(MalformedInputException.class);
        assertThatThrownBy(() -> CommitRecordMapper.normalizeHash("a".repeat(41)))
                .isInstanceOf(MalformedInputException.class);
    }

    @Test
    void normalizeTimestamp_AcceptsSupportedForms() {
        assertThat(CommitRecordMapper.normalizeTimestamp("2024-03-01T10:15:30Z")).isEqualTo("2024-03-01T10:15:30Z");
        assertThat(CommitRecordMapper.normalizeTimestamp("2024-03-01 10:15:30 +0800")).isEqualTo("2024-03-01T02:15:30Z");
        assertThat(CommitRecordMapper.normalizeTimestamp("2024-03-01T10:15:30")).isEqualTo("2024-03-01T10:15:30Z");
        assertThat(CommitRecordMapper.normalizeTimestamp(" ")).isNull();
    }

    @Test
    void normalizeTimestamp_RejectsGarbage() {
        assertThatThrownBy(() -> CommitRecordMapper.normalizeTimestamp("yesterday"))
                .isInstanceOf(MalformedInputException.class)
                .hasMessageContaining("yesterday");
    }

    @Test
    void fieldLongerThanItsColumn_IsMalformed() {
        String tooLong = "x".repeat(256);

        assertThatThrownBy(() -> mapper.toEntity(CommitInput.builder().project(tooLong).hash(SHA1).build()))
                .isInstanceOf(MalformedInputException.class)
                .hasMessageContaining("project");
        assertThatThrownBy(() -> mapper.toEntity(
                CommitInput.builder().project("core").hash(SHA1).changeId(tooLong).build()))
                .isInstanceOf(MalformedInputException.class)
                .hasMessageContaining("changeId");
        assertThatThrownBy(() -> mapper.toEntity(
                CommitInput.builder().project("core").hash(SHA1).author(tooLong).build()))
                .isInstanceOf(MalformedInputException.class)
                .hasMessageContaining("author");
    }

    @Test
    void fieldAtColumnWidth_IsAccepted() {
        String atLimit = "x".repeat(255);

        CommitRecord record = mapper.toEntity(CommitInput.builder()
                .project(atLimit).hash(SHA1).changeId(atLimit).author(atLimit).build());

        assertThat(record.getProject()).hasSize(255);
        assertThat(record.getChangeIdentifier()).hasSize(255);
        assertThat(record.getAuthor()).hasSize(255);
    }

    @Test
    void normalizeTimestamp_DropsFractionSoStringOrderMatchesTime() {
        String whole = CommitRecordMapper.normalizeTimestamp("2024-01-01T00:00:00Z");
        String fractional = CommitRecordMapper.normalizeTimestamp("2024-01-01T00:00:00.500Z");
        String nextSecond = CommitRecordMapper.normalizeTimestamp("2024-01-01T00:00:01Z");

        assertThat(fractional).isEqualTo("2024-01-01T00:00:00Z");
        assertThat(whole.compareTo(fractional)).isZero();
        assertThat(fractional.compareTo(nextSecond)).isNegative();
        assertThat(CommitRecordMapper.normalizeTimestamp("2024-03-01T10:15:30.999999+08:00"))
                .isEqualTo("2024-03-01T02:15:30Z");
    }
}
