package io.relayindex.cli;

import io.relayindex.config.RelayIndexConfig;
import io.relayindex.model.Constraint;
import io.relayindex.model.LocationConstraint;
import io.relayindex.model.LocationConstraints;
import io.relayindex.relaylist.RelayItem;
import io.relayindex.relaylist.RelayList;
import io.relayindex.storage.RelayListLoader;
import io.relayindex.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "relayindex",
        mixinStandardHelpOptions = true,
        description = "Relay list lookup CLI",
        subcommands = {
                RelayIndexCommand.FindCommand.class,
                RelayIndexCommand.TreeCommand.class
        }
)
public final class RelayIndexCommand implements Runnable {
    static final int EXIT_NOT_FOUND = 1;
    static final int EXIT_BAD_CONSTRAINT = 2;

    private static final Logger log = LoggerFactory.getLogger(RelayIndexCommand.class);

    @Spec
    CommandSpec spec;

    @Option(names = {"--root"}, description = "Data root directory holding relays.json", defaultValue = "data")
    String root;

    @Option(names = {"--relays"}, description = "Relay list JSON file (overrides <root>/relays.json)")
    String relays;

    @Override
    public void run() {
        spec.commandLine().getOut().println("Use subcommands: find | tree");
    }

    RelayIndexConfig config() {
        return RelayIndexConfig.fromRoot(root, relays);
    }

    RelayList relayList() {
        return new RelayList(RelayListLoader.load(config().relayListFile()));
    }

    @Command(name = "find", description = "Resolve a location constraint (any | cc | cc/city | cc/city/hostname)")
    static final class FindCommand implements Callable<Integer> {
        @ParentCommand
        RelayIndexCommand parent;

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Location constraint")
        String constraint;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            Constraint<LocationConstraint> parsed;
            try {
                parsed = LocationConstraints.parse(constraint);
            } catch (IllegalArgumentException e) {
                spec.commandLine().getErr().println(e.getMessage());
                return EXIT_BAD_CONSTRAINT;
            }
            RelayList relayList = parent.relayList();
            Optional<RelayItem> item = relayList.findItemForLocation(parsed);
            String formatted = LocationConstraints.format(parsed);
            if (item.isEmpty()) {
                log.debug("No relay item matches {}", formatted);
                out.println("No relay item matches: " + formatted);
                return EXIT_NOT_FOUND;
            }
            out.println(Jsons.toJson(RelayItemViews.describe(item.get())));
            return 0;
        }
    }

    @Command(name = "tree", description = "Print the full country, city and relay hierarchy")
    static final class TreeCommand implements Callable<Integer> {
        @ParentCommand
        RelayIndexCommand parent;

        @Spec
        CommandSpec spec;

        @Override
        public Integer call() {
            RelayList relayList = parent.relayList();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("relayCount", relayList.relayCount());
            out.put("countries", relayList.countries());
            spec.commandLine().getOut().println(Jsons.toJson(out));
            return 0;
        }
    }
}
