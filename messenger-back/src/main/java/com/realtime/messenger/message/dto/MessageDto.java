package com.realtime.messenger.message.dto;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.realtime.messenger.message.entity.MessageKind;
import com.realtime.messenger.user.dto.UserBriefDto;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MessageDto {
    private UUID id;
    private UserBriefDto sender;
    private UserBriefDto receiver;
    private String text;
    private MessageKind messageType;
    private String mediaUrl;
    private ReplyPreviewDto replyTo;

    @JsonProperty("isRead")
    private boolean read;
    private Instant readAt;

    private List<ReactionDto> reactions;

    @JsonProperty("isDeleted")
    private boolean deleted;

    private boolean oneTimeView;
    private Instant viewedAt;
    private Instant createdAt;
}
