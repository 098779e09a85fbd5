package net.vigil;

import io.micrometer.core.instrument.MockClock;
import net.vigil.Profiler.Agent;
import net.vigil.Profiler.Annotations.Measured;
import net.vigil.Profiler.Aspect.MeasuredAspect;
import net.vigil.Profiler.Config.VigilProperties;
import net.vigil.Profiler.CustomObject.Section;
import net.vigil.Profiler.CustomObject.Trace;
import net.vigil.Profiler.Delivery.Client;
import net.vigil.Profiler.Delivery.DeliveryQueue;
import net.vigil.Profiler.Metrics.NoOpMetricsRecorder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.aop.aspectj.annotation.AspectJProxyFactory;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MeasuredAspectTest {

    @Mock
    private DeliveryQueue queue;

    @Mock
    private Client client;

    private Agent agent;

    private OrderService orders;

    public static class OrderService {

        @Measured
        public int place(int quantity) {
            return quantity * 2;
        }

        @Measured(name = "orders/index", kind = "view")
        public String render() {
            return "<ul></ul>";
        }

        @Measured(kind = "cache", appendableCommand = true)
        public String lookup(String key) {
            return "value-" + key;
        }

        @Measured
        public void export() throws IOException {
            throw new IOException("disk full");
        }

        public String unmeasured() {
            return "plain";
        }
    }

    @BeforeEach
    void setUp() {
        agent = new Agent(new VigilProperties(), queue, client, new NoOpMetricsRecorder(), new MockClock());

        AspectJProxyFactory factory = new AspectJProxyFactory(new OrderService());
        factory.setProxyTargetClass(true);
        factory.addAspect(new MeasuredAspect(agent));
        orders = factory.getProxy();
    }

    @Test
    void testIdleCallBecomesJobNamedAfterMethod() {
        int result = orders.place(2);

        assertEquals(4, result);
        ArgumentCaptor<Trace> traceCaptor = ArgumentCaptor.forClass(Trace.class);
        verify(queue).pushJob(traceCaptor.capture());
        assertEquals("OrderService#place", traceCaptor.getValue().getName());
    }

    @Test
    void testCallsInsideRequestBecomeMergedSections() {
        agent.startRequest("OrdersController#index", "/orders");
        orders.render();
        orders.render();
        agent.stopRequest();

        ArgumentCaptor<Trace> traceCaptor = ArgumentCaptor.forClass(Trace.class);
        verify(queue).pushRequest(traceCaptor.capture());
        verify(queue, never()).pushJob(any());

        List<Section> sections = traceCaptor.getValue().getSections().asList();
        assertEquals(1, sections.size());
        assertEquals("orders/index", sections.get(0).getCommand());
        assertEquals("view", sections.get(0).getKind());
        assertEquals(2, sections.get(0).getCalls());
    }

    @Test
    void testAppendableCallOnIdleThreadIsNotTraced() {
        assertEquals("value-a", orders.lookup("a"));

        verifyNoInteractions(queue);
    }

    @Test
    void testCheckedExceptionReachesCaller() {
        IOException thrown = assertThrows(IOException.class, () -> orders.export());

        assertEquals("disk full", thrown.getMessage());
        ArgumentCaptor<Trace> traceCaptor = ArgumentCaptor.forClass(Trace.class);
        verify(queue).pushJob(traceCaptor.capture());
        assertEquals("java.io.IOException", traceCaptor.getValue().getError().getException());
    }

    @Test
    void testUnannotatedMethodIsNotMeasured() {
        assertEquals("plain", orders.unmeasured());

        verifyNoInteractions(queue);
    }
}
