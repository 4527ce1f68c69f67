package com.foreman.dispatch.api;

import com.foreman.core.events.AutoModeEvent;
import com.foreman.core.events.EventBus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.foreman.core.events.AutoModeEvent.payload;
import static org.junit.jupiter.api.Assertions.*;

class SseStreamingServiceTest {

    private EventBus eventBus;
    private SseStreamingService service;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        service = new SseStreamingService(eventBus);
    }

    private static AutoModeEvent event(String projectPath, String featureId) {
        return AutoModeEvent.of(AutoModeEvent.AUTO_MODE_PROGRESS, projectPath, null, featureId,
                payload("content", "compiling"));
    }

    @Nested
    @DisplayName("createEmitter")
    class CreateEmitter {

        @Test
        @DisplayName("each call creates a separate emitter")
        void separateEmitters() {
            SseEmitter first = service.createEmitter("/work/app");
            SseEmitter second = service.createEmitter("/work/app");

            assertNotSame(first, second);
            assertEquals(2, service.activeEmitterCount());
        }

        @Test
        @DisplayName("a blank project path follows every project")
        void allProjects() {
            assertNotNull(service.createEmitter(null));
            assertNotNull(service.createEmitter(" "));
            assertEquals(2, service.activeEmitterCount());
        }
    }

    @Nested
    @DisplayName("event forwarding")
    class Forwarding {

        @Test
        @DisplayName("publishing to project and global emitters does not throw")
        void publish() {
            service.createEmitter("/work/app");
            service.createEmitter(null);

            assertDoesNotThrow(() -> eventBus.publish(event("/work/app", "F-1")));
            assertDoesNotThrow(() -> eventBus.publish(event("/work/other", null)));
            assertEquals(2, service.activeEmitterCount());
        }

        @Test
        @DisplayName("concurrent publishing does not throw")
        void concurrentPublish() throws InterruptedException {
            service.createEmitter("/work/app");
            int threads = 5;
            var done = new CountDownLatch(threads);

            for (int t = 0; t < threads; t++) {
                new Thread(() -> {
                    for (int i = 0; i < 20; i++) {
                        eventBus.publish(AutoModeEvent.of(AutoModeEvent.AUTO_MODE_PROGRESS, "/work/app", null,
                                "F-1", Map.of("content", "line " + i)));
                    }
                    done.countDown();
                }).start();
            }

            assertTrue(done.await(5, TimeUnit.SECONDS));
        }
    }
}
