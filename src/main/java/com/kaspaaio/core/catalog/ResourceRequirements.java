package com.kaspaaio.core.catalog;

/**
 * Minimum and recommended host resources for a profile. Memory and disk are in GB.
 */
public record ResourceRequirements(
    int minCpu,
    int minMemoryGb,
    int minDiskGb,
    int recommendedCpu,
    int recommendedMemoryGb,
    int recommendedDiskGb
) {

    public static ResourceRequirements of(int cpu, int memoryGb, int diskGb) {
        return new ResourceRequirements(cpu, memoryGb, diskGb, cpu, memoryGb, diskGb);
    }

    public static final ResourceRequirements NONE = of(0, 0, 0);

    public ResourceRequirements plus(ResourceRequirements other) {
        return new ResourceRequirements(
                minCpu + other.minCpu,
                minMemoryGb + other.minMemoryGb,
                minDiskGb + other.minDiskGb,
                recommendedCpu + other.recommendedCpu,
                recommendedMemoryGb + other.recommendedMemoryGb,
                recommendedDiskGb + other.recommendedDiskGb);
    }
}
