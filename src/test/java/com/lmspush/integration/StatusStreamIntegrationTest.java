package com.lmspush.integration;

import com.lmspush.content.ContentRecord;
import com.lmspush.content.ContentType;
import com.lmspush.content.Grade;
import com.lmspush.push.PushOrchestrator;
import com.lmspush.push.PushRequest;
import com.lmspush.push.PushStatus;
import com.lmspush.status.PushStatusStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Server-sent status stream over a real HTTP connection.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class StatusStreamIntegrationTest {

    @Autowired TestRestTemplate rest;
    @Autowired PushOrchestrator orchestrator;
    @Autowired PushStatusStore statusStore;

    @Test
    void finishedPush_streamsOneTerminalEvent_thenCloses() {
        String pushId = orchestrator.submit(new PushRequest(content(), "nowhere", false));
        await().atMost(Duration.ofSeconds(10)).until(() ->
            statusStore.find(pushId).map(r -> r.status() == PushStatus.FAILED).orElse(false));

        ResponseEntity<String> response = openStream(pushId);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        String body = response.getBody();
        assertNotNull(body);
        assertEquals(1, countEvents(body), body);
        assertTrue(body.contains("event:status"), body);
        assertTrue(body.contains("\"status\":\"failed\""), body);
        assertTrue(body.contains("\"id\":\"" + pushId + "\""), body);
    }

    @Test
    void inFlightPush_streamEndsWithTerminalEvent() {
        String pushId = orchestrator.submit(new PushRequest(content(), "unreachable_webhook", false));

        ResponseEntity<String> response = openStream(pushId);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        String body = response.getBody();
        assertNotNull(body);
        assertTrue(countEvents(body) >= 1, body);
        String lastEvent = body.substring(body.lastIndexOf("event:status"));
        assertTrue(lastEvent.contains("\"status\":\"failed\""), body);
        assertTrue(lastEvent.contains("\"retry_count\":3"), body);
    }

    @Test
    void unknownPush_isNotFound() {
        ResponseEntity<String> response = openStream("no-such-push");
        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
    }

    private ResponseEntity<String> openStream(String pushId) {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.TEXT_EVENT_STREAM));
        return rest.exchange("/v1/pushes/" + pushId + "/stream", HttpMethod.GET,
            new HttpEntity<>(headers), String.class);
    }

    private static int countEvents(String body) {
        return body.split("event:status", -1).length - 1;
    }

    private static ContentRecord content() {
        return new ContentRecord("learner-9", "Katherine Johnson", "kj@example.edu", "quiz-3",
            ContentType.QUIZ, "Orbital mechanics quiz", null, "https://lms.example.com/quiz/3",
            Instant.parse("2026-03-02T11:00:00Z"), Grade.A, Set.of("math"), Map.of(), null);
    }
}
