package io.tongchi.cli;

import io.tongchi.config.TongchiConfig;
import io.tongchi.model.ChildDescriptor;
import io.tongchi.model.ExpandResult;
import io.tongchi.runtime.TongchiRuntime;
import io.tongchi.tree.ListerRegistry;
import io.tongchi.tree.ResourceTree;
import io.tongchi.tree.WorkspaceLister;
import io.tongchi.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
        name = "tongchi",
        mixinStandardHelpOptions = true,
        description = "Tongchi control-plane browser core",
        subcommands = {
                TongchiCommand.SettingsCommand.class,
                TongchiCommand.BrowseCommand.class,
                TongchiCommand.MetricsCommand.class
        }
)
public final class TongchiCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: settings | browse | metrics");
    }

    TongchiRuntime runtime() {
        return new TongchiRuntime(TongchiConfig.fromRoot(root));
    }

    @Command(name = "settings", description = "Print effective settings as JSON")
    static final class SettingsCommand implements Callable<Integer> {
        @ParentCommand
        TongchiCommand parent;

        @Override
        public Integer call() {
            try (TongchiRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.reloadSettings()));
            }
            return 0;
        }
    }

    @Command(name = "browse", description = "Expand a local workspace directory and print its children")
    static final class BrowseCommand implements Callable<Integer> {
        static final String TREE = "workspaces";

        @ParentCommand
        TongchiCommand parent;

        @Parameters(index = "0", arity = "0..1", defaultValue = "", description = "Path below the workspace root, e.g. infra/")
        String path;

        @Option(names = {"--workspace-dir"}, description = "Workspace root (default: <root>/workspaces)")
        String workspaceDir;

        @Option(names = {"--depth"}, defaultValue = "1", description = "Levels of containers to expand")
        int depth;

        @Override
        public Integer call() {
            try (TongchiRuntime runtime = parent.runtime()) {
                Path base = workspaceDir == null || workspaceDir.isBlank()
                        ? runtime.config().workspacesRoot()
                        : Paths.get(workspaceDir);
                ListerRegistry listers = new ListerRegistry();
                listers.bind("", new WorkspaceLister(base));
                ResourceTree tree = runtime.registerTree(TREE, listers);
                List<ExpandResult> results = new ArrayList<>();
                expand(tree, path == null ? "" : path, Math.max(1, depth), results);
                System.out.println(Jsons.toJson(results));
                return results.get(0).ok() ? 0 : 1;
            }
        }

        private static void expand(ResourceTree tree, String path, int remaining, List<ExpandResult> out) {
            ExpandResult result = tree.expand(path);
            out.add(result);
            if (remaining <= 1 || !result.ok()) {
                return;
            }
            for (ChildDescriptor child : result.children()) {
                if (child.container()) {
                    expand(tree, ResourceTree.childPath(path, child), remaining - 1, out);
                }
            }
        }
    }

    @Command(name = "metrics", description = "Print Prometheus metrics text")
    static final class MetricsCommand implements Callable<Integer> {
        @ParentCommand
        TongchiCommand parent;

        @Override
        public Integer call() {
            try (TongchiRuntime runtime = parent.runtime()) {
                System.out.print(runtime.metricsText());
            }
            return 0;
        }
    }
}
