// Licensed to the Apache Software Foundation (ASF) under one
// or more contributor license agreements.  See the NOTICE file
// distributed with this work for additional information
// regarding copyright ownership.  The ASF licenses this file
// to you under the Apache License, Version 2.0 (the
// "License"); you may not use this file except in compliance
// with the License.  You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing,
// software distributed under the License is distributed on an
// "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
// KIND, either express or implied.  See the License for the
// specific language governing permissions and limitations
// under the License.

package org.apache.letrec.planner.jobs.rewrite;

import org.apache.letrec.planner.NormalizationContext;
import org.apache.letrec.planner.jobs.JobContext;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import javax.annotation.Nullable;

/**
 * A named group of jobs. The executor never runs a topic itself: it splices the topic's jobs
 * into its own list when the topic applies to the current plan.
 */
public class TopicRewriteJob implements RewriteJob {

    private final String topicName;
    private final List<RewriteJob> jobs;
    @Nullable
    private final Predicate<NormalizationContext> condition;

    /**
     * @param condition checked against the plan when the executor reaches the topic, null means always
     */
    public TopicRewriteJob(String topicName, List<RewriteJob> jobs,
            @Nullable Predicate<NormalizationContext> condition) {
        this.topicName = Objects.requireNonNull(topicName, "topicName can not be null");
        this.jobs = flatten(jobs);
        this.condition = condition;
    }

    /**
     * 展开无条件的主题，有条件的主题保持原样，以便执行时再判断。
     */
    public static List<RewriteJob> flatten(List<RewriteJob> jobs) {
        ImmutableList.Builder<RewriteJob> flattened = ImmutableList.builder();
        for (RewriteJob job : jobs) {
            if (job == null) {
                continue;
            }
            if (job instanceof TopicRewriteJob && ((TopicRewriteJob) job).isUnconditional()) {
                flattened.addAll(((TopicRewriteJob) job).jobs);
            } else {
                flattened.add(job);
            }
        }
        return flattened.build();
    }

    public String getTopicName() {
        return topicName;
    }

    public List<RewriteJob> getJobs() {
        return jobs;
    }

    public boolean isUnconditional() {
        return condition == null;
    }

    public boolean appliesTo(NormalizationContext context) {
        return condition == null || condition.test(context);
    }

    @Override
    public void execute(JobContext jobContext) {
        throw new IllegalStateException("topic " + topicName + " is expanded by the executor, not executed");
    }

    @Override
    public boolean isOnce() {
        return true;
    }

    @Override
    public String toString() {
        return "topic " + topicName + (condition == null ? "" : " (conditional)") + " " + jobs;
    }
}
