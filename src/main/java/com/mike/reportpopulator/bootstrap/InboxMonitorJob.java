package com.mike.reportpopulator.bootstrap;

import com.mike.reportpopulator.config.InboxMonitorProperties;
import com.mike.reportpopulator.dto.ExtractionResult;
import com.mike.reportpopulator.dto.InboundEmail;
import com.mike.reportpopulator.dto.InboxRunSummary;
import com.mike.reportpopulator.service.ExtractionResultSink;
import com.mike.reportpopulator.service.catalog.JsonCatalogStore;
import com.mike.reportpopulator.service.extraction.ExtractionConfig;
import com.mike.reportpopulator.service.extraction.StructuredDataExtractor;
import com.mike.reportpopulator.service.mail.MailSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Component
@Slf4j
public class InboxMonitorJob {

    private final MailSource mailSource;
    private final JsonCatalogStore catalogStore;
    private final StructuredDataExtractor extractor;
    private final List<ExtractionResultSink> sinks;
    private final InboxMonitorProperties props;

    // message id -> received time, for messages newer than the cut-off only
    private final Map<String, LocalDateTime> processedMessages = new HashMap<>();
    private volatile LocalDateTime receivedAfter;

    public InboxMonitorJob(MailSource mailSource,
                           JsonCatalogStore catalogStore,
                           StructuredDataExtractor extractor,
                           List<ExtractionResultSink> sinks,
                           InboxMonitorProperties props) {
        this.mailSource = mailSource;
        this.catalogStore = catalogStore;
        this.extractor = extractor;
        this.sinks = sinks;
        this.props = props;
        this.receivedAfter = LocalDateTime.now().minusDays(Math.max(0, props.filterDays()));
    }

    @Scheduled(fixedDelayString = "${reportpopulator.monitor.interval-millis:60000}")
    public void runScheduled() {
        InboxRunSummary summary = runOnce();
        log.info("InboxMonitorJob: {}", summary.toLogLine());
    }

    public synchronized InboxRunSummary runOnce() {
        if (!props.enabled()) {
            log.debug("InboxMonitorJob: disabled via property reportpopulator.monitor.enabled=false");
            return InboxRunSummary.disabled();
        }

        List<InboundEmail> emails;
        ExtractionConfig config;
        try {
            emails = mailSource.fetchReceivedAfter(receivedAfter);
            config = catalogStore.loadExtractionConfig();
        } catch (Exception e) {
            log.warn("InboxMonitorJob: run aborted (receivedAfter={}): {}", receivedAfter, e.getMessage(), e);
            return InboxRunSummary.builder().enabled(true).build();
        }

        int skipped = 0;
        int extracted = 0;
        int failed = 0;

        // The cut-off only moves past messages up to the first failure, so a failed
        // message is fetched again on the next run.
        for (InboundEmail email : emails) {
            if (processedMessages.containsKey(email.messageId())) {
                skipped++;
                advanceCutOff(email, failed);
                continue;
            }
            processedMessages.put(email.messageId(), email.receivedAt());
            try {
                ExtractionResult result = extractor.extract(email.body(), config);
                log.debug("InboxMonitorJob: messageId={} subject='{}' -> {}",
                        email.messageId(), email.subject(), result.toLogLine());
                for (ExtractionResultSink sink : sinks) {
                    sink.accept(email, result);
                }
                extracted++;
                advanceCutOff(email, failed);
            } catch (Exception e) {
                failed++;
                processedMessages.remove(email.messageId());
                log.warn("InboxMonitorJob: error while processing messageId={}: {}",
                        email.messageId(), e.getMessage());
            }
        }

        forgetBeforeCutOff();

        return InboxRunSummary.builder()
                .enabled(true)
                .messagesFetched(emails.size())
                .messagesSkipped(skipped)
                .messagesExtracted(extracted)
                .messagesFailed(failed)
                .build();
    }

    private void advanceCutOff(InboundEmail email, int failedSoFar) {
        if (failedSoFar == 0 && email.receivedAt() != null && email.receivedAt().isAfter(receivedAfter)) {
            receivedAfter = email.receivedAt();
        }
    }

    // Messages at or before the cut-off are not fetched again. Ids without a received
    // time are kept because the mail source cannot filter them out.
    private void forgetBeforeCutOff() {
        processedMessages.values().removeIf(receivedAt -> receivedAt != null && !receivedAt.isAfter(receivedAfter));
    }

    synchronized int processedCount() {
        return processedMessages.size();
    }

    LocalDateTime getReceivedAfter() {
        return receivedAfter;
    }
}
