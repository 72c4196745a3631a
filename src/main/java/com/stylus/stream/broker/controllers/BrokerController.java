package com.stylus.stream.broker.controllers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.stylus.stream.broker.exceptions.BrokerException;
import com.stylus.stream.broker.exceptions.QueueTicketNotFoundException;
import com.stylus.stream.broker.exceptions.SessionNotFoundException;
import com.stylus.stream.broker.exceptions.SessionOwnershipException;
import com.stylus.stream.broker.model.*;
import com.stylus.stream.broker.service.BrokerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.servlet.http.HttpServletRequest;
import java.util.List;

import static com.stylus.stream.broker.conf.CommonConfig.DEFAULT_OBJECT_MAPPER;

@Slf4j
@RestController
@RequestMapping("/broker/")
@RequiredArgsConstructor
public class BrokerController {
    public static final String USER_ID_HEADER = "X-User-Id";

    private final BrokerService brokerService;

    @PostMapping("channel/request")
    @Nonnull
    public ChannelResponse requestChannel(@RequestBody ChannelRequest request, HttpServletRequest servletRequest) throws BrokerException {
        if (request == null) {
            throw new IllegalArgumentException("empty channel request");
        }
        if (StringUtils.isBlank(request.getIpAddress())) {
            request.setIpAddress(servletRequest.getRemoteAddr());
        }
        return brokerService.requestChannel(request);
    }

    @PostMapping("session/heartbeat")
    @Nonnull
    public HeartbeatResponse heartbeat(@RequestBody SessionRequest request) throws SessionNotFoundException {
        brokerService.heartbeat(requireSessionId(request));
        return new HeartbeatResponse(true);
    }

    @PostMapping(value = "session/release", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Nonnull
    public ReleaseResponse release(@RequestBody SessionRequest request,
                                   @RequestHeader(value = USER_ID_HEADER, required = false) String userId) throws SessionOwnershipException {
        return release(requireSessionId(request), userId);
    }

    /**
     * Page unload beacon. Browsers send it as text/plain with the json inside.
     */
    @PostMapping(value = "session/release", consumes = MediaType.TEXT_PLAIN_VALUE)
    @Nonnull
    public ReleaseResponse releaseBeacon(@RequestBody String body,
                                         @RequestHeader(value = USER_ID_HEADER, required = false) String userId) throws SessionOwnershipException {
        SessionRequest request;
        try {
            request = DEFAULT_OBJECT_MAPPER.readValue(body, SessionRequest.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("malformed release beacon", e);
        }
        return release(requireSessionId(request), userId);
    }

    @DeleteMapping("session/{sessionId}")
    @Nonnull
    public ReleaseResponse releaseById(@PathVariable String sessionId,
                                       @RequestHeader(value = USER_ID_HEADER, required = false) String userId) throws SessionOwnershipException {
        return release(sessionId, userId);
    }

    @Nonnull
    private ReleaseResponse release(@Nonnull String sessionId, @Nullable String userId) throws SessionOwnershipException {
        return ReleaseResponse.of(brokerService.releaseSession(sessionId, userId) ? 1 : 0);
    }

    @GetMapping("session/{sessionId}")
    @Nonnull
    public StreamSession getSession(@PathVariable String sessionId) throws SessionNotFoundException {
        return brokerService.getSession(sessionId);
    }

    @GetMapping("user/{userId}/sessions")
    @Nonnull
    public List<StreamSession> getUserSessions(@PathVariable String userId) {
        return brokerService.getUserSessions(userId);
    }

    @DeleteMapping("user/{userId}/sessions")
    @Nonnull
    public ReleaseResponse releaseUserSessions(@PathVariable String userId) {
        return ReleaseResponse.of(brokerService.releaseUserSessions(userId));
    }

    @GetMapping("queue/{ticketId}")
    @Nonnull
    public ChannelResponse getQueueTicket(@PathVariable String ticketId) throws QueueTicketNotFoundException {
        return brokerService.getQueueTicket(ticketId);
    }

    @DeleteMapping("queue/{ticketId}")
    @Nonnull
    public ReleaseResponse cancelQueued(@PathVariable String ticketId) {
        return ReleaseResponse.of(brokerService.cancelQueued(ticketId) ? 1 : 0);
    }

    @GetMapping("status")
    @Nonnull
    public BrokerStatus status() {
        return brokerService.getStatus();
    }

    @Nonnull
    private static String requireSessionId(@Nullable SessionRequest request) {
        if (request == null || StringUtils.isBlank(request.getSessionId())) {
            throw new IllegalArgumentException("empty session id");
        }
        return request.getSessionId();
    }
}
