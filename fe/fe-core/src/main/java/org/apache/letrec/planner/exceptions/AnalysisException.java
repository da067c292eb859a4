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

package org.apache.letrec.planner.exceptions;

/**
 * Exception for a plan the normalizer can not accept, or for a broken internal invariant.
 * The run is aborted and no partial plan is returned.
 */
public class AnalysisException extends RuntimeException {

    /** Error code of the exception. */
    public enum ErrorCode {
        /** a reference to an id that is declared nowhere, or an id declared twice in one visibility chain */
        SCOPING_VIOLATION,
        /** a reference to an id that is declared, but not visible at the use site */
        FORWARD_REFERENCE,
        /** a rewrite did not reach a fixpoint within the iteration bound */
        FIXPOINT_NOT_CONVERGED,
        INVALID_PLAN
    }

    private final ErrorCode errorCode;

    public AnalysisException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public AnalysisException(String message) {
        this(ErrorCode.INVALID_PLAN, message);
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * true when the failure points at the normalizer itself rather than at the plan it was given.
     */
    public boolean isInternalError() {
        return errorCode == ErrorCode.FIXPOINT_NOT_CONVERGED;
    }

    @Override
    public String getMessage() {
        return errorCode + ": " + super.getMessage();
    }
}
