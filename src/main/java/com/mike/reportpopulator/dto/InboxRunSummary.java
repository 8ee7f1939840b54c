package com.mike.reportpopulator.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class InboxRunSummary {
    boolean enabled;

    int messagesFetched;
    int messagesSkipped;
    int messagesExtracted;
    int messagesFailed;

    public static InboxRunSummary disabled() {
        return InboxRunSummary.builder()
                .enabled(false)
                .build();
    }

    public String toLogLine() {
        return "enabled=" + enabled +
                " messagesFetched=" + messagesFetched +
                " messagesSkipped=" + messagesSkipped +
                " messagesExtracted=" + messagesExtracted +
                " messagesFailed=" + messagesFailed;
    }
}
