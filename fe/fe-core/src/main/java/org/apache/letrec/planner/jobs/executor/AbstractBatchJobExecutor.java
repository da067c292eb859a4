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

package org.apache.letrec.planner.jobs.executor;

import org.apache.letrec.planner.NormalizationContext;
import org.apache.letrec.planner.exceptions.AnalysisException;
import org.apache.letrec.planner.exceptions.AnalysisException.ErrorCode;
import org.apache.letrec.planner.jobs.JobContext;
import org.apache.letrec.planner.jobs.rewrite.CustomRewriteJob;
import org.apache.letrec.planner.jobs.rewrite.RewriteJob;
import org.apache.letrec.planner.jobs.rewrite.TopicRewriteJob;
import org.apache.letrec.planner.rules.RuleType;
import org.apache.letrec.planner.trees.plans.visitor.CustomRewriter;

import com.google.common.collect.Lists;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Base class for executing all jobs.
 *
 * Each batch of rules will be uniformly executed.
 */
public abstract class AbstractBatchJobExecutor {
    private static final Logger LOG = LogManager.getLogger(AbstractBatchJobExecutor.class);

    protected NormalizationContext normalizationContext;

    public AbstractBatchJobExecutor(NormalizationContext normalizationContext) {
        this.normalizationContext = Objects.requireNonNull(normalizationContext,
                "normalizationContext can not null");
    }

    /**
     * 扁平化处理重写作业列表：过滤空值，展开无条件的 TopicRewriteJob，有条件的保持包装结构。
     */
    public static List<RewriteJob> jobs(RewriteJob... jobs) {
        return TopicRewriteJob.flatten(Arrays.asList(jobs));
    }

    public static TopicRewriteJob topic(String topicName, RewriteJob... jobs) {
        return new TopicRewriteJob(topicName, Arrays.asList(jobs), null);
    }

    public static TopicRewriteJob topic(String topicName, Predicate<NormalizationContext> condition,
            RewriteJob... jobs) {
        return new TopicRewriteJob(topicName, Arrays.asList(jobs), condition);
    }

    public static RewriteJob custom(RuleType ruleType, Supplier<CustomRewriter> planRewriter) {
        return new CustomRewriteJob(planRewriter, ruleType);
    }

    /**
     * 执行批量重写作业。
     *
     * <p>TopicRewriteJob 的条件满足时，其子作业被插入到当前位置之后。
     * 对于 {@code isOnce() == false} 的作业，重复执行直到计划不再变化（Fixed Point），
     * 每个作业的执行次数受 maxFixpointIterations 限制，超过后以 FIXPOINT_NOT_CONVERGED 失败。
     */
    public void execute() {
        List<RewriteJob> jobs = Lists.newArrayList(getJobs());
        int maxIterations = normalizationContext.getSessionVariable().getMaxFixpointIterations();

        for (int i = 0; i < jobs.size(); i++) {
            JobContext jobContext = normalizationContext.getCurrentJobContext();
            RewriteJob currentJob = jobs.get(i);

            if (currentJob instanceof TopicRewriteJob) {
                TopicRewriteJob topicRewriteJob = (TopicRewriteJob) currentJob;
                if (topicRewriteJob.appliesTo(jobContext.getNormalizationContext())) {
                    jobs.addAll(i + 1, topicRewriteJob.getJobs());
                } else if (LOG.isDebugEnabled()) {
                    LOG.debug("skip {}", topicRewriteJob);
                }
                continue;
            }

            if (shouldRun(currentJob, jobContext, jobs, i)) {
                int iterations = 0;
                do {
                    if (iterations++ >= maxIterations) {
                        throw new AnalysisException(ErrorCode.FIXPOINT_NOT_CONVERGED,
                                describe(currentJob) + " did not converge in " + maxIterations + " iterations");
                    }
                    jobContext.setRewritten(false);
                    currentJob.execute(jobContext);
                } while (!currentJob.isOnce() && jobContext.isRewritten());
                if (LOG.isDebugEnabled()) {
                    LOG.debug("{} finished after {} iteration(s)", describe(currentJob), iterations);
                }
            }
        }
    }

    public abstract List<RewriteJob> getJobs();

    protected boolean shouldRun(RewriteJob rewriteJob, JobContext jobContext, List<RewriteJob> jobs, int jobIndex) {
        return true;
    }

    private static String describe(RewriteJob job) {
        return job instanceof CustomRewriteJob
                ? "rule " + ((CustomRewriteJob) job).getRuleType()
                : "job " + job.getClass().getSimpleName();
    }
}
