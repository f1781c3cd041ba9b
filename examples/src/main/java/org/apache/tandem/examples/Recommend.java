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
package org.apache.tandem.examples;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.util.List;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.commons.math3.util.Pair;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.io.IOUtils;
import org.apache.tandem.TandemConfiguration;
import org.apache.tandem.examples.util.InteractionFormat;
import org.apache.tandem.io.RecommendationRecord;
import org.apache.tandem.io.TextPair;
import org.apache.tandem.pipeline.BotFilter;
import org.apache.tandem.pipeline.ItemSimilarityPipeline;
import org.apache.tandem.similarity.ScoringStrategy;
import org.apache.tandem.stash.Stash;
import org.apache.tandem.stash.StashContext;
import org.apache.tandem.stash.StashWriter;
import org.json.simple.JSONArray;

import com.google.common.base.Charsets;

/**
 * Reads tab separated (user, item) interaction files, computes the similar
 * items of every item and writes them as JSON lines
 * <code>[item, [[candidate, score], ...]]</code>.
 */
public class Recommend {

  private static final Log LOG = LogFactory.getLog(Recommend.class);

  static Options options() {
    Options opts = new Options();
    opts.addOption("i", "input", true,
        "Comma separated interaction files or directories.");
    opts.addOption("o", "output", true, "The JSON lines output file.");
    opts.addOption("r", "rounds", true, "The number of MinHash rounds. "
        + "Default value is " + ItemSimilarityPipeline.DEFAULT_ROUNDS + ".");
    opts.addOption("k", "top_k", true, "Recommendations per item. "
        + "Default value is " + ItemSimilarityPipeline.DEFAULT_TOP_K + ".");
    opts.addOption("m", "max_interactions", true,
        "Users with more distinct items are dropped as bots. Default value is "
            + BotFilter.DEFAULT_MAX_INTERACTIONS + ".");
    opts.addOption("w", "work_dir", true,
        "Directory of the intermediate files.");
    opts.addOption("s", "seed", true, "Seed for a reproducible run.");
    opts.addOption("t", "threads", true,
        "The number of rounds computed concurrently. Default value is 1.");
    opts.addOption("b", "bucket", false,
        "Score all pairs of a bucket instead of adjacent items only.");
    opts.addOption("p", "persist", true,
        "Keep the records as a sequence file of this name in the work dir.");
    opts.addOption("h", "help", false, "Print usage");
    return opts;
  }

  public static void main(String[] args) throws Exception {
    int exitCode = run(args, new TandemConfiguration());
    if (exitCode != 0) {
      System.exit(exitCode);
    }
  }

  /**
   * @return the exit code, 0 on success
   */
  public static int run(String[] args, Configuration conf) throws IOException {
    Options opts = options();
    CommandLine cliParser;
    try {
      cliParser = new GnuParser().parse(opts, args);
    } catch (ParseException e) {
      System.out.println(e.getMessage());
      new HelpFormatter().printHelp("recommend -i INPUT -o OUTPUT [options]",
          opts);
      return -1;
    }

    if (cliParser.hasOption("h")) {
      new HelpFormatter().printHelp("recommend -i INPUT -o OUTPUT [options]",
          opts);
      return 0;
    }
    if (!cliParser.hasOption("i") || !cliParser.hasOption("o")) {
      System.out.println("Input and output paths are required, exiting.");
      new HelpFormatter().printHelp("recommend -i INPUT -o OUTPUT [options]",
          opts);
      return -1;
    }

    try {
      configure(cliParser, conf);
      ItemSimilarityPipeline.validate(conf);
    } catch (IllegalArgumentException e) {
      System.out.println("Invalid option: " + e.getMessage());
      return -1;
    }

    String[] inputs = cliParser.getOptionValue("i").split(",");
    Path[] inputPaths = new Path[inputs.length];
    for (int i = 0; i < inputs.length; i++) {
      inputPaths[i] = new Path(inputs[i].trim());
    }
    Path output = new Path(cliParser.getOptionValue("o"));

    long startTime = System.currentTimeMillis();
    StashContext context = new StashContext(conf);
    try {
      InteractionFormat format = new InteractionFormat();
      StashWriter<TextPair> raw = context.newWriter(TextPair.class);
      for (Path file : InteractionFormat.listInputs(conf, inputPaths)) {
        format.read(file.getFileSystem(conf), file, raw);
      }
      if (format.getMalformed() > 0) {
        LOG.warn("Skipped " + format.getMalformed() + " malformed lines out of "
            + format.getLines());
      }

      ItemSimilarityPipeline pipeline = new ItemSimilarityPipeline(conf,
          context, TandemConfiguration.newRandom(conf));
      Stash<RecommendationRecord> records = pipeline.run(raw.close());

      long written = writeJson(records, output.getFileSystem(conf), output);
      LOG.info("Wrote " + written + " records to " + output);
      if (cliParser.hasOption("p")) {
        Path persisted = context.persist(records,
            cliParser.getOptionValue("p"));
        LOG.info("Persisted records to " + persisted);
      }
    } finally {
      context.close();
    }
    System.out.println("Job Finished in "
        + (System.currentTimeMillis() - startTime) / 1000.0 + " seconds");
    return 0;
  }

  private static void configure(CommandLine cliParser, Configuration conf) {
    if (cliParser.hasOption("r")) {
      conf.setInt(ItemSimilarityPipeline.ROUNDS_KEY,
          parseInt(cliParser, "r"));
    }
    if (cliParser.hasOption("k")) {
      conf.setInt(ItemSimilarityPipeline.TOP_K_KEY, parseInt(cliParser, "k"));
    }
    if (cliParser.hasOption("m")) {
      conf.setInt(BotFilter.MAX_INTERACTIONS_KEY, parseInt(cliParser, "m"));
    }
    if (cliParser.hasOption("t")) {
      conf.setInt(ItemSimilarityPipeline.THREADS_KEY, parseInt(cliParser, "t"));
    }
    if (cliParser.hasOption("w")) {
      conf.set(StashContext.WORK_DIR_KEY, cliParser.getOptionValue("w"));
    }
    if (cliParser.hasOption("s")) {
      conf.setLong(TandemConfiguration.RANDOM_SEED_KEY,
          parseLong(cliParser, "s"));
    }
    if (cliParser.hasOption("b")) {
      conf.set(ItemSimilarityPipeline.STRATEGY_KEY,
          ScoringStrategy.BUCKET.name().toLowerCase());
    }
  }

  private static int parseInt(CommandLine cliParser, String opt) {
    String value = cliParser.getOptionValue(opt);
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("-" + opt + " expects a number, got "
          + value);
    }
  }

  private static long parseLong(CommandLine cliParser, String opt) {
    String value = cliParser.getOptionValue(opt);
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("-" + opt + " expects a number, got "
          + value);
    }
  }

  /**
   * Writes one JSON array per record.
   *
   * @return the number of records written
   */
  @SuppressWarnings("unchecked")
  static long writeJson(Iterable<RecommendationRecord> records,
      FileSystem fs, Path output) throws IOException {
    long count = 0;
    BufferedWriter writer = new BufferedWriter(new OutputStreamWriter(
        fs.create(output, true), Charsets.UTF_8));
    try {
      for (RecommendationRecord record : records) {
        JSONArray candidates = new JSONArray();
        List<Pair<String, Float>> pairs = record.getCandidates();
        for (Pair<String, Float> pair : pairs) {
          JSONArray candidate = new JSONArray();
          candidate.add(pair.getFirst());
          candidate.add(pair.getSecond());
          candidates.add(candidate);
        }
        JSONArray row = new JSONArray();
        row.add(record.getItem());
        row.add(candidates);
        writer.write(row.toJSONString());
        writer.newLine();
        count++;
      }
      writer.close();
    } finally {
      IOUtils.closeStream(writer);
    }
    return count;
  }
}
