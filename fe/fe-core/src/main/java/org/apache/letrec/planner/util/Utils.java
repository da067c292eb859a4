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

package org.apache.letrec.planner.util;

import com.google.common.collect.ImmutableList;
import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.List;

/**
 * Utils for planner.
 */
public class Utils {

    private Utils() {
    }

    /** skip the copy if the list is already immutable */
    public static <E> ImmutableList<E> fastToImmutableList(List<? extends E> list) {
        if (list instanceof ImmutableList) {
            return (ImmutableList<E>) list;
        }
        return ImmutableList.copyOf(list);
    }

    public static <E> ImmutableList<E> fastToImmutableList(E[] array) {
        return ImmutableList.copyOf(array);
    }

    /** render as '(a, b, c)' */
    public static String toTuple(List<?> items) {
        return "(" + StringUtils.join(items, ", ") + ")";
    }

    /** render column indexes as '#0, #1' */
    public static String columnRefs(List<Integer> columns) {
        return StringUtils.join(columns.stream().map(c -> "#" + c).toArray(), ", ");
    }

    /** parse a comma separated list, blanks dropped */
    public static List<String> splitList(String value) {
        if (StringUtils.isBlank(value)) {
            return ImmutableList.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(StringUtils::isNotEmpty)
                .collect(ImmutableList.toImmutableList());
    }
}
