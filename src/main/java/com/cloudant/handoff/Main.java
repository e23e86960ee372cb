// Licensed under the Apache License, Version 2.0 (the "License"); you may not
// use this file except in compliance with the License. You may obtain a copy of
// the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
// WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
// License for the specific language governing permissions and limitations under
// the License.

package com.cloudant.handoff;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.apache.commons.configuration.CompositeConfiguration;
import org.apache.commons.configuration.FileConfiguration;
import org.apache.commons.configuration.HierarchicalINIConfiguration;
import org.apache.commons.configuration.SystemConfiguration;
import org.apache.log4j.Logger;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;

/**
 * Line hand-off pipe: every line read from stdin is added to a
 * {@link ConcurrentList}, and a {@link ListDrainer} thread writes each drained
 * batch to stdout.
 */
public class Main {

    private static final Logger logger = Logger.getLogger("handoff.main");

    private static final MetricRegistry METRIC_REGISTRY = new MetricRegistry();
    private static final JmxReporter JMX_REPORTER = JmxReporter.forRegistry(METRIC_REGISTRY).build();

    private static final Thread SHUTDOWN_HOOK = new Thread() {
        public void run() {
            JMX_REPORTER.stop();
        }
    };

    static {
        JMX_REPORTER.start();
        Runtime.getRuntime().addShutdownHook(SHUTDOWN_HOOK);
    }

    public static void main(final String[] args) throws Exception {
        Thread.setDefaultUncaughtExceptionHandler((t, e) -> {
            logger.fatal("Uncaught exception", e);
            System.exit(1);
        });

        final CompositeConfiguration config = new CompositeConfiguration();
        config.addConfiguration(new SystemConfiguration());

        final String fileName = args.length > 0 ? args[0] : "handoff.ini";
        final FileConfiguration fileConfig = new HierarchicalINIConfiguration(fileName);
        config.addConfiguration(fileConfig);

        final ConcurrentLists lists = new ConcurrentLists(config, METRIC_REGISTRY);
        final ConcurrentList<String> lines = lists.create("lines");
        final PrintStream out = System.out;
        final ListDrainer<String> drainer = lists.drainer(lines, batch -> {
            for (final String line : batch) {
                out.println(line);
            }
            out.flush();
        });

        final Thread worker = new Thread(drainer, "HandoffDrainer");
        worker.start();
        logger.info(String.format("Handoff running with signal capacity %d",
                config.getInt("handoff.signal_capacity", ConcurrentList.DEFAULT_SIGNAL_CAPACITY)));

        final BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        try {
            String line;
            while ((line = in.readLine()) != null) {
                lines.add(line);
            }
        } finally {
            drainer.stop();
            worker.join();
            lines.close();
        }

        final ListMetrics metrics = lines.getMetrics();
        logger.info(String.format("Handoff done: added=%d, drains=%d, dropped signals=%d", metrics.getAdded(),
                metrics.getDrains(), metrics.getSignalsDropped()));
    }

}
