package com.trancheledger.allocation;

import java.util.List;
import lombok.Value;

@Value
public class AllocationResult {

    List<DividendAllocation> allocations;
    List<UnallocatedDividend> unallocated;
}
