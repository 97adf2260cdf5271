package com.fintech.gaps.resource;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;

/**
 * {@link MemoryProbe} backed by the platform {@link MemoryMXBean}: heap plus
 * non-heap usage of the running JVM.
 */
public class JvmMemoryProbe implements MemoryProbe {

    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private final MemoryMXBean memoryBean;

    public JvmMemoryProbe() {
        this(ManagementFactory.getMemoryMXBean());
    }

    JvmMemoryProbe(MemoryMXBean memoryBean) {
        this.memoryBean = memoryBean;
    }

    @Override
    public double usedMb() {
        long used = memoryBean.getHeapMemoryUsage().getUsed()
            + memoryBean.getNonHeapMemoryUsage().getUsed();
        return used / BYTES_PER_MB;
    }

    @Override
    public void reclaim() {
        memoryBean.gc();
    }
}
