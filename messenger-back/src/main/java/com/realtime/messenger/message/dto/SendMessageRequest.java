package com.realtime.messenger.message.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** durable 전송 요청. sender 는 인증 컨텍스트에서 정한다 */
@Getter
@Setter
@NoArgsConstructor
public class SendMessageRequest {
    @NotBlank
    private String receiver;

    @NotBlank
    @Size(max = 4000)
    private String text;

    private String messageType;   // 없으면 text
    @Size(max = 1024)
    private String mediaUrl;
    private String replyTo;
    private Boolean oneTimeView;
}
