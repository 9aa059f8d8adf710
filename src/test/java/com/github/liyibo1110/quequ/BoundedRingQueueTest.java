package com.github.liyibo1110.quequ;

import com.github.liyibo1110.quequ.stats.QueueStats;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicIntegerArray;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.IntSupplier;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link BoundedRingQueue}的单元测试
 * @author liyibo
 * @date 2026-02-08 11:20
 */
class BoundedRingQueueTest {

    @SuppressWarnings("unchecked")
    static <E> Quequ<E> builder() {
        return (Quequ<E>)(Quequ<?>)Quequ.newBuilder();
    }

    // 单线程

    @Test
    void minimumCapacityAppliesToSmallRequests() {
        RingQueue<String> queue = Quequ.newQueue(4);
        assertEquals(8, queue.capacity());
        assertEquals(0, queue.count());
        assertTrue(queue.isEmpty());
    }

    @Test
    void putThenGetWalkthrough() {
        RingQueue<String> queue = Quequ.newQueue(4);

        assertEquals(PutResult.success(1), queue.put("a"));
        assertEquals(PutResult.success(2), queue.put("b"));
        assertEquals(PutResult.success(3), queue.put("c"));
        assertEquals(3, queue.count());

        GetResult<String> first = queue.get();
        assertEquals("a", first.value());
        assertTrue(first.ok());
        assertEquals(2, first.count());

        assertEquals(GetResult.success("b", 1), queue.get());
        assertEquals(GetResult.success("c", 0), queue.get());

        GetResult<String> empty = queue.get();
        assertNull(empty.value());
        assertFalse(empty.ok());
        assertEquals(0, empty.count());
        assertEquals(Outcome.ADMISSION_DENIED, empty.outcome());
    }

    @Test
    void getOnEmptyKeepsFailingUntilPut() {
        RingQueue<Integer> queue = Quequ.newQueue(16);
        for(int i = 0; i < 5; i++) {
            GetResult<Integer> result = queue.get();
            assertFalse(result.ok());
            assertFalse(result.outcome().madeProgress());
        }
        assertTrue(queue.put(42).ok());
        assertEquals(42, queue.get().value());
        assertFalse(queue.get().ok());
    }

    @Test
    void fifoOrder() {
        RingQueue<Integer> queue = Quequ.newQueue(64);
        for(int i = 0; i < 50; i++)
            assertTrue(queue.put(i).ok());
        for(int i = 0; i < 50; i++)
            assertEquals(i, queue.get().value());
        assertTrue(queue.isEmpty());
    }

    @Test
    void putKeepsTwoSlotMargin() {
        RingQueue<Integer> queue = Quequ.newQueue(8);
        for(int i = 1; i <= 6; i++) {
            PutResult result = queue.put(i);
            assertTrue(result.ok());
            assertEquals(i, result.count());
        }

        PutResult full = queue.put(7);
        assertFalse(full.ok());
        assertEquals(Outcome.ADMISSION_DENIED, full.outcome());
        assertEquals(6, full.count());
        assertEquals(6, queue.count());

        assertEquals(1, queue.get().value());
        assertTrue(queue.put(7).ok());
    }

    @Test
    void wrapAroundKeepsOrder() {
        RingQueue<Integer> queue = Quequ.newQueue(8);
        int next = 0;
        int expected = 0;
        for(int round = 0; round < 50; round++) {
            for(int i = 0; i < 5; i++)
                assertTrue(queue.put(next++).ok());
            for(int i = 0; i < 5; i++)
                assertEquals(expected++, queue.get().value());
            assertTrue(queue.isEmpty());
        }
    }

    @Test
    void cursorOverflowPastSignedRange() {
        BoundedRingQueue<Integer> queue = new BoundedRingQueue<>(builder(), Integer.MAX_VALUE - 3);
        this.cycleThrough(queue);
        assertTrue(queue.writeCursor() < 0, "write cursor should have crossed Integer.MAX_VALUE");
    }

    @Test
    void cursorOverflowPastUnsignedRange() {
        BoundedRingQueue<Integer> queue = new BoundedRingQueue<>(builder(), -5);
        this.cycleThrough(queue);
        assertTrue(queue.writeCursor() > 0, "write cursor should have wrapped through zero");
    }

    private void cycleThrough(BoundedRingQueue<Integer> queue) {
        int next = 0;
        int expected = 0;
        for(int round = 0; round < 20; round++) {
            for(int i = 0; i < 4; i++) {
                PutResult put = queue.put(next++);
                assertTrue(put.ok());
                assertEquals(i + 1, put.count());
            }
            assertEquals(4, queue.count());
            for(int i = 0; i < 4; i++) {
                GetResult<Integer> get = queue.get();
                assertEquals(expected++, get.value());
                assertEquals(3 - i, get.count());
            }
            assertFalse(queue.get().ok());
        }
    }

    @Test
    void slotZeroStartsOneLapAhead() {
        BoundedRingQueue<Object> queue = new BoundedRingQueue<>(builder(), 0);
        assertEquals(8, queue.slots[0].writeGeneration);
        assertEquals(8, queue.slots[0].readGeneration);
        for(int i = 1; i < 8; i++) {
            assertEquals(i, queue.slots[i].writeGeneration);
            assertEquals(i, queue.slots[i].readGeneration);
        }
    }

    @Test
    void slotGenerationsAdvanceByOneLap() {
        BoundedRingQueue<String> queue = new BoundedRingQueue<>(builder(), 0);
        BoundedRingQueue.Slot slot = queue.slots[1];

        assertTrue(queue.put("x").ok());
        assertEquals(9, slot.writeGeneration);
        assertEquals(1, slot.readGeneration);
        assertEquals("x", slot.element);

        assertEquals("x", queue.get().value());
        assertEquals(9, slot.writeGeneration);
        assertEquals(9, slot.readGeneration);
        assertNull(slot.element);
    }

    @Test
    void estimateUsesWrappingDifference() {
        assertEquals(0, BoundedRingQueue.estimate(7, 7));
        assertEquals(3, BoundedRingQueue.estimate(4, 7));
        assertEquals(3, BoundedRingQueue.estimate(-2, 1));
        assertEquals(2, BoundedRingQueue.estimate(Integer.MAX_VALUE, Integer.MIN_VALUE + 1));
    }

    @Test
    void putNullThrows() {
        RingQueue<String> queue = Quequ.newQueue(8);
        assertThrows(NullPointerException.class, () -> queue.put(null));
        assertTrue(queue.isEmpty());
    }

    @Test
    void lostReservationLeavesNoTrace() {
        BoundedRingQueue<String> queue = new BoundedRingQueue<>(builder(), 0);
        assertTrue(queue.put("a").ok());

        // 模拟另一个消费者刚好抢先推进了读游标
        assertTrue(queue.casReadCursor(0, 1));
        assertFalse(queue.casReadCursor(0, 1));
        assertEquals(1, queue.readCursor());
        assertEquals("a", queue.slots[1].element);
    }

    @Test
    void recordsStats() {
        RingQueue<Integer> queue = Quequ.newBuilder().recordStats().build();
        assertTrue(queue.put(1).ok());
        assertTrue(queue.put(2).ok());
        assertEquals(1, queue.get().value());
        assertEquals(2, queue.get().value());
        assertFalse(queue.get().ok());

        QueueStats stats = queue.stats();
        assertEquals(2, stats.putSuccessCount());
        assertEquals(2, stats.getSuccessCount());
        assertEquals(1, stats.getDeniedCount());
        assertEquals(3, stats.getCount());
        assertEquals(0, stats.putLostCount());
        assertEquals(0, stats.slotSpinCount());
    }

    @Test
    void statsDisabledByDefault() {
        RingQueue<Integer> queue = Quequ.newQueue(8);
        assertTrue(queue.put(1).ok());
        assertEquals(QueueStats.empty(), queue.stats());
    }

    @Test
    void evictionListenerFailureIsSwallowed() {
        Quequ<String> builder = builder();
        builder.starvationThreshold(10)
                .evictionListener(e -> { throw new IllegalStateException("boom"); });
        BoundedRingQueue<String> queue = new BoundedRingQueue<>(builder, 0);
        assertDoesNotThrow(() -> queue.notifyEviction("x"));
    }

    // 饥饿保护阀

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    void starvedProducerEvictsOldestElements() throws Exception {
        List<String> evicted = new CopyOnWriteArrayList<>();
        CountDownLatch firstEviction = new CountDownLatch(1);
        Quequ<String> builder = builder();
        builder.starvationThreshold(20)
                .recordStats()
                .evictionListener(e -> {
                    evicted.add(e);
                    firstEviction.countDown();
                });
        BoundedRingQueue<String> queue = new BoundedRingQueue<>(builder, 0);

        for(int i = 1; i <= 6; i++)
            assertTrue(queue.put(String.valueOf(i)).ok());
        // 一个消费者预定了"1"所在的槽位，然后迟迟没有读走
        assertTrue(queue.casReadCursor(0, 1));
        assertEquals("2", queue.get().value());
        assertEquals("3", queue.get().value());
        assertTrue(queue.put("7").ok());
        assertTrue(queue.put("8").ok());

        // "9"会落在被占住的槽位1上
        AtomicReference<PutResult> result = new AtomicReference<>();
        Thread producer = new Thread(() -> result.set(queue.put("9")), "starved-producer");
        producer.start();

        assertTrue(firstEviction.await(20, TimeUnit.SECONDS), "valve never fired");
        assertEquals("4", evicted.get(0));

        // 卡住的消费者终于读走了"1"
        BoundedRingQueue.Slot stuck = queue.slots[1];
        assertEquals("1", stuck.element);
        stuck.element = null;
        stuck.release(queue.capacity());

        producer.join();
        assertTrue(result.get().ok());

        List<String> drained = new ArrayList<>();
        for(GetResult<String> get = queue.get(); get.ok(); get = queue.get())
            drained.add(get.value());

        List<String> expected = new ArrayList<>(List.of("4", "5", "6", "7", "8"));
        assertEquals(expected.subList(0, evicted.size()), evicted);
        expected.removeAll(evicted);
        expected.add("9");
        assertEquals(expected, drained);
        assertEquals(evicted.size(), queue.stats().starvationEvictionCount());
    }

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    void starvedConsumerInjectsPlaceholders() throws Exception {
        Quequ<String> builder = builder();
        builder.starvationThreshold(20)
                .recordStats()
                .starvationPlaceholder("placeholder");
        BoundedRingQueue<String> queue = new BoundedRingQueue<>(builder, 0);

        // 一个生产者预定了槽位1，然后迟迟没有发布
        assertTrue(queue.casWriteCursor(0, 1));

        AtomicReference<GetResult<String>> result = new AtomicReference<>();
        Thread consumer = new Thread(() -> result.set(queue.get()), "starved-consumer");
        consumer.start();

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(20);
        while(queue.stats().starvationInjectionCount() == 0) {
            assertTrue(System.nanoTime() < deadline, "valve never fired");
            Thread.sleep(1);
        }

        BoundedRingQueue.Slot stuck = queue.slots[1];
        stuck.element = "real";
        stuck.publish(queue.capacity());

        consumer.join();
        assertEquals("real", result.get().value());

        int placeholders = 0;
        for(GetResult<String> get = queue.get(); get.ok(); get = queue.get()) {
            assertEquals("placeholder", get.value());
            placeholders++;
        }
        assertEquals(queue.stats().starvationInjectionCount(), placeholders);
        assertTrue(placeholders >= 1);
    }

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    void starvedProducersNeverWaitOnEachOther() throws Exception {
        List<String> evicted = new CopyOnWriteArrayList<>();
        Quequ<String> builder = builder();
        builder.starvationThreshold(5)
                .recordStats()
                .evictionListener(evicted::add);
        BoundedRingQueue<String> queue = new BoundedRingQueue<>(builder, 0);

        for(int i = 1; i <= 6; i++)
            assertTrue(queue.put(String.valueOf(i)).ok());
        // 两个消费者分别预定了"1"和"2"所在的槽位，然后迟迟没有读走
        assertTrue(queue.casReadCursor(0, 1));
        assertTrue(queue.casReadCursor(1, 2));
        assertEquals("3", queue.get().value());
        assertTrue(queue.put("7").ok());
        assertTrue(queue.put("8").ok());

        // "9"落在槽位1上，"10"落在槽位2上，两个生产者都会卡住
        Thread first = new Thread(() -> assertTrue(queue.put("9").ok()), "starved-producer-9");
        first.start();
        awaitCursor(queue::writeCursor, 9);
        Thread second = new Thread(() -> {
            while(!queue.put("10").ok()) {
                Thread.onSpinWait();
            }
        }, "starved-producer-10");
        second.start();
        awaitCursor(queue::writeCursor, 10);

        // 能取走的元素都取走之后，读游标停在两个卡住的槽位前面
        awaitCursor(queue::readCursor, 8);
        Thread.sleep(50);
        assertEquals(8, queue.readCursor());

        // 卡住的消费者终于读走了"1"和"2"，两个生产者都应该能完成
        for(int index = 1; index <= 2; index++) {
            BoundedRingQueue.Slot stuck = queue.slots[index];
            assertEquals(String.valueOf(index), stuck.element);
            stuck.element = null;
            stuck.release(queue.capacity());
        }
        first.join(5_000);
        second.join(5_000);
        assertFalse(first.isAlive());
        assertFalse(second.isAlive());

        assertEquals(List.of("4", "5", "6", "7", "8"), evicted.stream().sorted().collect(Collectors.toList()));
        assertEquals("9", queue.get().value());
        assertEquals("10", queue.get().value());
        assertTrue(queue.isEmpty());
        assertEquals(5, queue.stats().starvationEvictionCount());
    }

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    void starvedConsumersNeverWaitOnEachOther() throws Exception {
        Quequ<String> builder = builder();
        builder.starvationThreshold(5)
                .recordStats()
                .starvationPlaceholder("placeholder");
        BoundedRingQueue<String> queue = new BoundedRingQueue<>(builder, 0);

        // 两个生产者分别预定了槽位1和2，然后迟迟没有发布
        assertTrue(queue.casWriteCursor(0, 1));
        assertTrue(queue.casWriteCursor(1, 2));

        AtomicReference<GetResult<String>> firstResult = new AtomicReference<>();
        AtomicReference<GetResult<String>> secondResult = new AtomicReference<>();
        Thread first = new Thread(() -> firstResult.set(queue.get()), "starved-consumer-1");
        first.start();
        awaitCursor(queue::readCursor, 1);
        Thread second = new Thread(() -> secondResult.set(queue.get()), "starved-consumer-2");
        second.start();
        awaitCursor(queue::readCursor, 2);

        // 占位元素填满槽位3到0，再取走它们，下一圈的槽位1和2还压着卡住的消费者
        awaitCursor(queue::writeCursor, 8);
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(20);
        while(queue.readCursor() != 8) {
            assertTrue(System.nanoTime() < deadline, "placeholders were never drained");
            GetResult<String> get = queue.get();
            if(get.ok())
                assertEquals("placeholder", get.value());
        }
        Thread.sleep(50);
        assertEquals(8, queue.writeCursor());
        assertEquals(6, queue.stats().starvationInjectionCount());

        for(int index = 1; index <= 2; index++) {
            BoundedRingQueue.Slot stuck = queue.slots[index];
            stuck.element = "real" + index;
            stuck.publish(queue.capacity());
        }
        first.join(5_000);
        second.join(5_000);
        assertFalse(first.isAlive());
        assertFalse(second.isAlive());

        assertEquals("real1", firstResult.get().value());
        assertEquals("real2", secondResult.get().value());
        assertTrue(queue.isEmpty());
    }

    private static void awaitCursor(IntSupplier cursor, int expected) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(20);
        while(cursor.getAsInt() != expected) {
            assertTrue(System.nanoTime() < deadline, "cursor never reached " + expected);
            Thread.sleep(1);
        }
    }

    // 多线程

    @Test
    @Timeout(value = 60, unit = TimeUnit.SECONDS)
    void spscKeepsOrder() throws Exception {
        final int itemCount = 200_000;
        RingQueue<Integer> queue = Quequ.newBuilder()
                .capacity(256)
                .waitStrategy(WaitStrategy.backingOff())
                .build();

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<?> producer = executor.submit(() -> {
                for(int i = 0; i < itemCount; i++) {
                    while(!queue.put(i).ok()) {
                        Thread.onSpinWait();
                    }
                }
            });
            Future<Integer> consumer = executor.submit(() -> {
                int expected = 0;
                while(expected < itemCount) {
                    GetResult<Integer> result = queue.get();
                    if(!result.ok())
                        continue;
                    assertEquals(expected, result.value());
                    expected++;
                }
                return expected;
            });
            producer.get();
            assertEquals(itemCount, consumer.get());
        } finally {
            executor.shutdownNow();
        }
        assertTrue(queue.isEmpty());
    }

    @Test
    @Timeout(value = 120, unit = TimeUnit.SECONDS)
    void mpmcStressLosesAndDuplicatesNothing() throws Exception {
        final int producers = 8;
        final int consumers = 8;
        final int perProducer = 10_000;
        final int total = producers * perProducer;

        RingQueue<Integer> queue = Quequ.newBuilder()
                .capacity(1024)
                .recordStats()
                .build();
        int capacity = queue.capacity();
        AtomicIntegerArray seen = new AtomicIntegerArray(total);
        AtomicInteger drained = new AtomicInteger();

        ExecutorService executor = Executors.newFixedThreadPool(producers + consumers);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for(int p = 0; p < producers; p++) {
                int base = p * perProducer;
                futures.add(executor.submit(() -> {
                    for(int i = 0; i < perProducer; i++) {
                        PutResult result;
                        do {
                            result = queue.put(base + i);
                        } while(!result.ok());
                        assertTrue(result.count() <= capacity - 2);
                    }
                }));
            }
            for(int c = 0; c < consumers; c++) {
                futures.add(executor.submit(() -> {
                    while(drained.get() < total) {
                        GetResult<Integer> result = queue.get();
                        if(result.ok()) {
                            seen.incrementAndGet(result.value());
                            drained.incrementAndGet();
                        }
                        int count = queue.count();
                        assertTrue(count >= 0 && count < capacity);
                    }
                }));
            }
            for(Future<?> future : futures)
                future.get();
        } finally {
            executor.shutdownNow();
        }

        assertEquals(total, drained.get());
        for(int i = 0; i < total; i++)
            assertEquals(1, seen.get(i), "value " + i + " drained wrong number of times");
        assertTrue(queue.isEmpty());

        QueueStats stats = queue.stats();
        assertEquals(total, stats.putSuccessCount());
        assertEquals(total, stats.getSuccessCount());
    }
}
