package com.sitelens.crawl.service;

import com.sitelens.config.CrawlerProperties;
import com.sitelens.crawl.model.CrawlFailureReason;
import com.sitelens.crawl.model.CrawlHistoryEntry;
import com.sitelens.crawl.model.CrawlRecord;
import com.sitelens.crawl.model.CrawlStatus;
import com.sitelens.crawl.persistence.CrawlJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

@Component
public class PendingCrawlRecoveryRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(PendingCrawlRecoveryRunner.class);
    static final String INTERRUPTED_MESSAGE = "Crawl interrupted by process restart";

    private final CrawlJdbcRepository repository;
    private final CrawlOrchestratorService orchestratorService;
    private final CrawlerProperties properties;

    public PendingCrawlRecoveryRunner(
        CrawlJdbcRepository repository,
        CrawlOrchestratorService orchestratorService,
        CrawlerProperties properties
    ) {
        this.repository = repository;
        this.orchestratorService = orchestratorService;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getRecovery().isEnabled()) {
            log.info("Pending crawl recovery disabled");
            return;
        }
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (Exception e) {
            dbConnected = false;
        }
        if (!dbConnected) {
            log.warn("Skipping pending crawl recovery because database is unreachable");
            return;
        }

        int interrupted = 0;
        for (CrawlRecord record : repository.findCrawlRecordsByStatus(CrawlStatus.PROCESSING)) {
            Instant now = Instant.now();
            String code = CrawlFailureReason.INTERRUPTED.code();
            if (repository.markFailed(record.crawlId(), code, INTERRUPTED_MESSAGE, now)) {
                repository.insertHistory(new CrawlHistoryEntry(
                    record.crawlId(),
                    record.url(),
                    record.domain(),
                    code,
                    null,
                    null,
                    INTERRUPTED_MESSAGE,
                    now
                ));
                interrupted++;
            }
        }

        List<CrawlRecord> pending = repository.findCrawlRecordsByStatus(CrawlStatus.PENDING);
        for (CrawlRecord record : pending) {
            orchestratorService.resume(record);
        }
        log.info("Pending crawl recovery finished rescheduled={} interrupted={}", pending.size(), interrupted);
    }
}
