package com.agentfleet.dispatch.cli;

import com.agentfleet.concurrency.ConcurrencyPolicies;
import com.agentfleet.concurrency.ConcurrencyPolicy;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.TreeMap;

/**
 * CLI command: agentfleet policies [name]
 */
@Command(name = "policies", mixinStandardHelpOptions = true,
        description = "Show the built-in concurrency policy presets")
@Component
public class PoliciesCommand implements Runnable {

    @Parameters(index = "0", arity = "0..1", description = "Preset to show: default, high-performance, conservative, serial")
    private String name;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        if (name != null) {
            try {
                print(name, ConcurrencyPolicies.byName(name));
            } catch (IllegalArgumentException e) {
                ConsoleOutput.error(e.getMessage());
            }
            return;
        }
        ConcurrencyPolicies.all().forEach(this::print);
    }

    private void print(String presetName, ConcurrencyPolicy policy) {
        ConsoleOutput.info(presetName + (ConcurrencyPolicies.isSerialMode(policy) ? " (serial)" : ""));
        System.out.printf("  global max:       %d%n", policy.globalMaxConcurrency());
        System.out.printf("  per resource:     %s%n", new TreeMap<>(policy.perResourceConcurrency()));
        System.out.printf("  queue strategy:   %s%n", policy.queueStrategy());
        System.out.printf("  estimator:        %s%n", policy.estimator());
        System.out.printf("  min benefit:      %dms%n", policy.minSchedulingBenefitMs());
        System.out.printf("  degradation:      above %.0f%% -> max %d%s%n",
                policy.degradationPolicy().resourceUsageThreshold() * 100,
                policy.degradationPolicy().degradedMaxConcurrency(),
                policy.degradationPolicy().pauseNewDispatches() ? ", admission paused" : "");
    }
}
