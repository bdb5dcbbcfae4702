package com.example.screenrelay.service;

import com.example.screenrelay.model.CloseReason;
import com.example.screenrelay.model.RelayEvent;
import com.example.screenrelay.model.RoomSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Tells the members of a closing room about it. Runs inside the registry's room lock, before
 * the room record is removed: when the host is gone viewers first get {@code stream:stopped},
 * then exactly one closure notice.
 */
@Component
public class RoomClosureNotifier {
    private static final Logger log = LoggerFactory.getLogger(RoomClosureNotifier.class);

    private final RelayRouter router;
    private final SessionDirectory directory;

    public RoomClosureNotifier(RelayRouter router, SessionDirectory directory) {
        this.router = router;
        this.directory = directory;
    }

    @EventListener
    public void onRoomClosing(RoomClosingEvent event) {
        RoomSnapshot room = event.room();
        CloseReason reason = event.reason();
        String excluded = reason.hostDeparted() ? room.hostId() : null;
        if (reason.hostDeparted()) {
            router.broadcast(room, RelayEvent.STREAM_STOPPED, null, excluded);
        }
        int notified = router.broadcast(room, reason.notice(), reason.message(), excluded);
        for (String memberId : room.memberIds()) {
            directory.clearRoom(memberId, room.code());
        }
        log.info("[ROOM] Room {} closed ({}), {} members notified", room.code(), reason, notified);
    }
}
