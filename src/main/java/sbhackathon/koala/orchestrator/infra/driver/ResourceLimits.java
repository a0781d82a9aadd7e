package sbhackathon.koala.orchestrator.infra.driver;

import io.kubernetes.client.custom.Quantity;

import java.math.BigDecimal;

/**
 * CPU and memory limits parsed from Kubernetes quantity strings, shared by both drivers.
 */
public record ResourceLimits(BigDecimal cpuCores, long memoryBytes) {

    private static final BigDecimal NANOS_PER_CORE = BigDecimal.valueOf(1_000_000_000L);

    public static ResourceLimits parse(String cpuLimit, String memoryLimit) {
        BigDecimal cpu = parseQuantity("cpuLimit", cpuLimit);
        BigDecimal memory = parseQuantity("memoryLimit", memoryLimit);
        if (cpu.signum() <= 0) {
            throw new InvalidSpecException("cpuLimit must be positive: " + cpuLimit);
        }
        if (memory.signum() <= 0) {
            throw new InvalidSpecException("memoryLimit must be positive: " + memoryLimit);
        }
        return new ResourceLimits(cpu, memory.longValue());
    }

    public long nanoCpus() {
        return cpuCores.multiply(NANOS_PER_CORE).longValue();
    }

    private static BigDecimal parseQuantity(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidSpecException(field + " must not be blank");
        }
        try {
            return Quantity.fromString(value.trim()).getNumber();
        } catch (RuntimeException e) {
            throw new InvalidSpecException("Invalid " + field + " '" + value + "': " + e.getMessage(), e);
        }
    }
}
