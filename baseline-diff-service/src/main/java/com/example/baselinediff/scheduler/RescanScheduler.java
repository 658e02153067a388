package com.example.baselinediff.scheduler;

import com.example.baselinediff.dto.request.ScanRequest;
import com.example.baselinediff.dto.response.ScanJobResponse;
import com.example.baselinediff.service.ScanService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic rescan of fixed upstream and vendor roots. Disabled unless
 * {@code baseline.scheduler.enabled=true}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "baseline.scheduler.enabled", havingValue = "true")
public class RescanScheduler {

    private final ScanService scanService;

    @Value("${baseline.scheduler.upstream-root}")
    private String upstreamRoot;

    @Value("${baseline.scheduler.vendor-root}")
    private String vendorRoot;

    @Scheduled(cron = "${baseline.scheduler.rescan-cron:0 0 3 * * *}")
    @SchedulerLock(
            name = "scheduledRescan",
            lockAtMostFor = "2h",
            lockAtLeastFor = "1m"
    )
    public void rescan() {
        log.info("=== Starting scheduled rescan: upstream={}, vendor={} ===", upstreamRoot, vendorRoot);
        try {
            ScanJobResponse job = scanService.runScanNow(ScanRequest.builder()
                    .upstreamRoot(upstreamRoot)
                    .vendorRoot(vendorRoot)
                    .build());
            log.info("=== Scheduled rescan finished: scanJobId={}, status={} ===", job.getId(), job.getStatus());
        } catch (Exception e) {
            log.error("Error in scheduled rescan: {}", e.getMessage(), e);
        }
    }
}
