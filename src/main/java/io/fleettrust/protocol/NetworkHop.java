/*
 * Copyright 2022 Neil Madden.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 *
 */

package io.fleettrust.protocol;

import static java.util.Objects.requireNonNull;

import java.util.List;
import java.util.Objects;

/**
 * One stage that processed a message: the endpoint it arrived on, the identity that handled it and the endpoint it
 * left on.
 */
public final class NetworkHop {
    private final String in;
    private final String processor;
    private final String out;

    public NetworkHop(String in, String processor, String out) {
        this.in = requireNonNull(in, "in");
        this.processor = requireNonNull(processor, "processor");
        this.out = requireNonNull(out, "out");
    }

    public String in() {
        return in;
    }

    public String processor() {
        return processor;
    }

    public String out() {
        return out;
    }

    List<String> asList() {
        return List.of(in, processor, out);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) { return true; }
        if (!(other instanceof NetworkHop)) { return false; }
        NetworkHop that = (NetworkHop) other;
        return in.equals(that.in) && processor.equals(that.processor) && out.equals(that.out);
    }

    @Override
    public int hashCode() {
        return Objects.hash(in, processor, out);
    }

    @Override
    public String toString() {
        return "[" + in + ", " + processor + ", " + out + "]";
    }
}
