package com.github.liyibo1110.quequ;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;

/**
 * 通过继承来实现字段填充的命名空间
 * 读游标和写游标分别被不同的线程群高频CAS，放在同一个缓存行上会互相拖累（伪共享）
 * @author liyibo
 * @date 2026-02-05 09:48
 */
final class QQHeader {

    private QQHeader() {}

    abstract static class PadReadCursor {
        byte p000, p001, p002, p003, p004, p005, p006, p007;
        byte p008, p009, p010, p011, p012, p013, p014, p015;
        byte p016, p017, p018, p019, p020, p021, p022, p023;
        byte p024, p025, p026, p027, p028, p029, p030, p031;
        byte p032, p033, p034, p035, p036, p037, p038, p039;
        byte p040, p041, p042, p043, p044, p045, p046, p047;
        byte p048, p049, p050, p051, p052, p053, p054, p055;
        byte p056, p057, p058, p059, p060, p061, p062, p063;
        byte p064, p065, p066, p067, p068, p069, p070, p071;
        byte p072, p073, p074, p075, p076, p077, p078, p079;
        byte p080, p081, p082, p083, p084, p085, p086, p087;
        byte p088, p089, p090, p091, p092, p093, p094, p095;
        byte p096, p097, p098, p099, p100, p101, p102, p103;
        byte p104, p105, p106, p107, p108, p109, p110, p111;
        byte p112, p113, p114, p115, p116, p117, p118, p119;
    }

    /** 读游标：成功预定过槽位的get次数 */
    abstract static class ReadCursorRef extends PadReadCursor {
        volatile int readCursor;
    }

    abstract static class PadWriteCursor extends ReadCursorRef {
        byte p120, p121, p122, p123, p124, p125, p126, p127;
        byte p128, p129, p130, p131, p132, p133, p134, p135;
        byte p136, p137, p138, p139, p140, p141, p142, p143;
        byte p144, p145, p146, p147, p148, p149, p150, p151;
        byte p152, p153, p154, p155, p156, p157, p158, p159;
        byte p160, p161, p162, p163, p164, p165, p166, p167;
        byte p168, p169, p170, p171, p172, p173, p174, p175;
        byte p176, p177, p178, p179, p180, p181, p182, p183;
        byte p184, p185, p186, p187, p188, p189, p190, p191;
        byte p192, p193, p194, p195, p196, p197, p198, p199;
        byte p200, p201, p202, p203, p204, p205, p206, p207;
        byte p208, p209, p210, p211, p212, p213, p214, p215;
        byte p216, p217, p218, p219, p220, p221, p222, p223;
        byte p224, p225, p226, p227, p228, p229, p230, p231;
        byte p232, p233, p234, p235, p236, p237, p238, p239;
    }

    /**
     * 写游标：成功预定过槽位的put次数
     * 两个游标都是32位的，溢出后回绕，只用+、-和==运算，和无符号回绕的结果一致
     */
    abstract static class ReadAndWriteCursorRef extends PadWriteCursor {
        static final VarHandle READ, WRITE;

        volatile int writeCursor;

        ReadAndWriteCursorRef(int initialCursor) {
            READ.setRelease(this, initialCursor);
            WRITE.setRelease(this, initialCursor);
        }

        int readCursor() {
            return this.readCursor;
        }

        int writeCursor() {
            return this.writeCursor;
        }

        /**
         * 只有1个线程能把某个游标值推进到下一个值，失败说明被别人抢先了
         */
        boolean casReadCursor(int expect, int update) {
            return READ.compareAndSet(this, expect, update);
        }

        boolean casWriteCursor(int expect, int update) {
            return WRITE.compareAndSet(this, expect, update);
        }

        static {
            MethodHandles.Lookup lookup = MethodHandles.lookup();
            try {
                READ = lookup.findVarHandle(ReadCursorRef.class, "readCursor", int.class);
                WRITE = lookup.findVarHandle(ReadAndWriteCursorRef.class, "writeCursor", int.class);
            } catch (ReflectiveOperationException e) {
                throw new ExceptionInInitializerError(e);
            }
        }
    }
}
