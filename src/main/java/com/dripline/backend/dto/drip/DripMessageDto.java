package com.dripline.backend.dto.drip;

import com.dripline.backend.enums.Channel;
import com.dripline.backend.enums.MessageStatus;
import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;

@Data
@Builder
public class DripMessageDto {
    private Long id;
    private Long journeyId;
    private Integer stepNumber;
    private Channel channel;
    private String subject;
    private MessageStatus status;
    private OffsetDateTime scheduledAt;
    private Integer attemptCount;
    private String lastError;
    private String providerMessageId;
    private OffsetDateTime sentAt;
    private OffsetDateTime deliveredAt;
    private OffsetDateTime openedAt;
    private OffsetDateTime clickedAt;
    private OffsetDateTime failedAt;
}
