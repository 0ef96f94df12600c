package com.example.objectcompressor;

import com.example.objectcompressor.runner.DirectCompressionRunner;
import com.example.objectcompressor.runner.EventDrivenRunner;
import com.example.objectcompressor.service.NotificationDispatcher;
import com.example.objectcompressor.transport.KafkaNotificationReceiver;
import com.example.objectcompressor.worker.JobQueue;
import com.example.objectcompressor.worker.WorkerPool;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.ApplicationContext;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "compressor.source-bucket=src-bucket",
        "compressor.destination-bucket=dst-bucket",
        "compressor.subscription=storage-notifications",
        "compressor.recovery-topic=storage-recovery",
        "compressor.workers=2"
})
class EventDrivenModeContextTest {

    // replaced so the context starts without subscribing or blocking on the root scope
    @MockBean
    private EventDrivenRunner runner;

    @Autowired
    private ApplicationContext context;

    @Test
    void contextLoads() {
        assertNotNull(context.getBean(NotificationDispatcher.class));
        assertNotNull(context.getBean(WorkerPool.class));
        assertNotNull(context.getBean(KafkaNotificationReceiver.class));
        assertEquals(2, context.getBean(JobQueue.class).capacity());
        assertTrue(context.getBeansOfType(DirectCompressionRunner.class).isEmpty());
    }
}
