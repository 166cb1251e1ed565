/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package SalesEtl;

import org.apache.flink.api.java.utils.ParameterTool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;

/**
 * Main entry point of the Sales Batch ETL pipeline.
 * <p>
 * The job runs three steps:
 * 1. Generates synthetic e-commerce transactions as JSON files.
 * 2. Converts the JSON files into delimited files, flattening nested fields.
 * 3. Cleans the transactions, derives the sales views and writes them as delimited files.
 * <p>
 * Usage:
 * <pre>
 *   SalesEtlJob [--config config/pipeline_config.json] [--use-flink] [--skip-generation]
 * </pre>
 * Step 3 runs in-process by default. With {@code --use-flink} (or {@code "backend": "flink"})
 * it runs as Flink batch jobs, on the cluster when the jar is submitted with {@code flink run}.
 */
public class SalesEtlJob {

    private static final Logger log = LoggerFactory.getLogger(SalesEtlJob.class);

    private static final String DEFAULT_CONFIG = "config/pipeline_config.json";

    public static void main(String[] args) {
        ParameterTool params = ParameterTool.fromArgs(args);

        PipelineConfig config = PipelineConfig.load(Paths.get(params.get("config", DEFAULT_CONFIG)));
        if (params.has("use-flink")) {
            config.setBackend(PipelineConfig.FLINK);
        }

        boolean success = new PipelineRunner(config).run(params.has("skip-generation"));
        if (!success) {
            log.error("Pipeline execution failed");
            System.exit(1);
        }
        log.info("Pipeline execution completed successfully");
    }
}
