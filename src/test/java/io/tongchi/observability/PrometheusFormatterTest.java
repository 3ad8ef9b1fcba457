package io.tongchi.observability;

import io.tongchi.runtime.TongchiRuntime;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

final class PrometheusFormatterTest {

    @Test
    void rendersGaugesWithLabels() {
        Map<String, Integer> nodes = new LinkedHashMap<>();
        nodes.put("loaded", 12);
        nodes.put("error", 1);
        Map<String, Long> perTree = new LinkedHashMap<>();
        perTree.put("vault", 9L);
        perTree.put("nomad", 4L);
        Map<String, Integer> processes = new LinkedHashMap<>();
        processes.put("running", 2);
        TongchiRuntime.StatsOutcome stats = new TongchiRuntime.StatsOutcome(
                2, nodes, 3, 13L, 1L, 40L, 6L, perTree, 5, 4, 100L, 7L, 2L, processes, 8);

        String text = PrometheusFormatter.format(stats);

        Assertions.assertTrue(text.contains("# TYPE tongchi_trees gauge\ntongchi_trees 2\n"));
        Assertions.assertTrue(text.contains("tongchi_nodes_total{status=\"loaded\"} 12\n"));
        Assertions.assertTrue(text.contains("tongchi_tree_lister_calls_total{tree=\"nomad\"} 4\n"));
        Assertions.assertTrue(text.contains("tongchi_scheduled_tasks{enabled=\"true\"} 4\n"));
        Assertions.assertTrue(text.contains("tongchi_scheduled_tasks{enabled=\"false\"} 1\n"));
        Assertions.assertTrue(text.contains("tongchi_processes_total{status=\"running\"} 2\n"));
        Assertions.assertTrue(text.contains("tongchi_tracked_leases 8\n"));
        Assertions.assertEquals(1, count(text, "# HELP tongchi_scheduled_tasks "));
        Assertions.assertEquals(1, count(text, "# HELP tongchi_tree_lister_calls_total "));
    }

    private static int count(String text, String needle) {
        int count = 0;
        int from = 0;
        while ((from = text.indexOf(needle, from)) >= 0) {
            count++;
            from += needle.length();
        }
        return count;
    }
}
