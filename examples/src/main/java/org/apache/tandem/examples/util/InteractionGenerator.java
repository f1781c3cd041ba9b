/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.tandem.examples.util;

import static com.google.common.base.Preconditions.checkArgument;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.util.HashSet;
import java.util.Set;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.commons.math3.distribution.ZipfDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.io.IOUtils;
import org.apache.tandem.TandemConfiguration;

import com.google.common.base.Charsets;

/**
 * Generates random interaction files for benchmarks. Item popularity follows a
 * Zipf law, so a few items are shared by many users and most are rare.
 */
public class InteractionGenerator {

  private static final Log LOG = LogFactory.getLog(InteractionGenerator.class);

  private final int users;
  private final int items;
  private final int maxEdges;
  private final RandomGenerator random;

  /**
   * @param maxEdges upper bound of the interactions of a user, each user gets
   *          between 1 and maxEdges distinct items.
   */
  public InteractionGenerator(int users, int items, int maxEdges, long seed) {
    checkArgument(users > 0, "users must be positive, but was " + users);
    checkArgument(items > 0, "items must be positive, but was " + items);
    checkArgument(maxEdges > 0 && maxEdges <= items,
        "edges must be in [1, items], but was " + maxEdges);
    this.users = users;
    this.items = items;
    this.maxEdges = maxEdges;
    this.random = new Well19937c(seed);
  }

  /**
   * @return the number of interactions written
   */
  public long generate(FileSystem fs, Path output) throws IOException {
    ZipfDistribution popularity = new ZipfDistribution(random, items, 1.0);
    Set<Integer> picked = new HashSet<Integer>();
    long written = 0;
    BufferedWriter writer = new BufferedWriter(new OutputStreamWriter(
        fs.create(output, true), Charsets.UTF_8));
    try {
      for (int u = 0; u < users; u++) {
        int edges = 1 + random.nextInt(maxEdges);
        picked.clear();
        while (picked.size() < edges) {
          picked.add(popularity.sample());
        }
        for (int item : picked) {
          writer.write(InteractionFormat.format("user" + u, "item" + item));
          writer.newLine();
          written++;
        }
      }
      writer.close();
    } finally {
      IOUtils.closeStream(writer);
    }
    LOG.info("Generated " + written + " interactions of " + users
        + " users into " + output);
    return written;
  }

  public static void main(String[] args) throws IOException, ParseException {
    Options opts = new Options();
    opts.addOption("u", "users", true, "The number of users. Default value is 1000.");
    opts.addOption("n", "items", true, "The number of items. Default value is 100.");
    opts.addOption("e", "edges", true,
        "The maximum number of items per user. Default value is 10.");
    opts.addOption("o", "output_path", true, "The Location of output path.");
    opts.addOption("s", "seed", true, "Seed of the generator.");
    opts.addOption("h", "help", false, "Print usage");

    CommandLine cliParser = new GnuParser().parse(opts, args);

    if (args.length == 0 || cliParser.hasOption("h")) {
      new HelpFormatter().printHelp("gen -o OUTPUT_PATH [options]", opts);
      return;
    }
    if (!cliParser.hasOption("o")) {
      System.out.println("No output path specified for gen, exiting.");
      System.exit(-1);
    }

    Configuration conf = new TandemConfiguration();
    long seed = cliParser.hasOption("s") ? Long.parseLong(cliParser
        .getOptionValue("s")) : System.nanoTime();
    InteractionGenerator generator = new InteractionGenerator(
        Integer.parseInt(cliParser.getOptionValue("users", "1000")),
        Integer.parseInt(cliParser.getOptionValue("items", "100")),
        Integer.parseInt(cliParser.getOptionValue("edges", "10")), seed);
    Path output = new Path(cliParser.getOptionValue("output_path"));
    generator.generate(output.getFileSystem(conf), output);
  }
}
