package com.example.screenrelay.controller;

import com.example.screenrelay.service.SessionSupervisor;
import org.junit.jupiter.api.Test;
import org.springframework.messaging.converter.MessageConversionException;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class SignalingControllerTest {

    private final SessionSupervisor supervisor = mock(SessionSupervisor.class);
    private final SignalingController controller = new SignalingController(supervisor);

    @Test
    void unreadablePayloadIsRejectedForTheSendingSession() throws Exception {
        SimpMessageHeaderAccessor headers = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
        headers.setSessionId("s1");
        headers.setDestination("/app/room:create");
        MessageConversionException error = new MessageConversionException("Cannot deserialize maxViewers");

        controller.unreadablePayload(error, headers);

        verify(supervisor).rejectUnreadable("s1", "/app/room:create", error);
        MessageExceptionHandler handler = SignalingController.class
                .getMethod("unreadablePayload", MessageConversionException.class, SimpMessageHeaderAccessor.class)
                .getAnnotation(MessageExceptionHandler.class);
        assertThat(handler.value()).containsExactly(MessageConversionException.class);
    }
}
