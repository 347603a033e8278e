/*
 * Copyright 2025 The Android Open Source Project
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.mediabridge.bluetooth.tbs;

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CallerNamePolicyTest {

    @Test
    public void sanitize_stripsBidiFormattingAndWhitespace() {
        assertThat(CallerNamePolicy.sanitize("\u202AJohn Smith\u202C ")).isEqualTo("John Smith");
        assertThat(CallerNamePolicy.sanitize("\u2066+1 555 0100\u2069")).isEqualTo("+1 555 0100");
        assertThat(CallerNamePolicy.sanitize(null)).isNull();
    }

    @Test
    public void normalizeNumber() {
        assertThat(CallerNamePolicy.normalizeNumber(null)).isNull();
        assertThat(CallerNamePolicy.normalizeNumber("")).isNull();
        assertThat(CallerNamePolicy.normalizeNumber("unknown")).isNull();
        assertThat(CallerNamePolicy.normalizeNumber("UNKNOWN")).isNull();
        assertThat(CallerNamePolicy.normalizeNumber(" +1 555 0100 ")).isEqualTo("+1 555 0100");
    }

    @Test
    public void isPlaceholder() {
        assertThat(CallerNamePolicy.isPlaceholder("Incoming Call")).isTrue();
        assertThat(CallerNamePolicy.isPlaceholder("ongoing CALL")).isTrue();
        assertThat(CallerNamePolicy.isPlaceholder("Private Number")).isTrue();
        assertThat(CallerNamePolicy.isPlaceholder("John")).isFalse();
        assertThat(CallerNamePolicy.isPlaceholder(null)).isFalse();
    }

    @Test
    public void isDenied() {
        assertThat(CallerNamePolicy.isDenied("Spam protection disabled")).isTrue();
        assertThat(CallerNamePolicy.isDenied("Allow Truecaller to identify")).isTrue();
        assertThat(CallerNamePolicy.isDenied("Go Premium")).isTrue();
        assertThat(CallerNamePolicy.isDenied("Blocked")).isTrue();
        assertThat(CallerNamePolicy.isDenied("John")).isFalse();
        assertThat(CallerNamePolicy.isDenied(null)).isFalse();
    }

    @Test
    public void isPhoneNumber() {
        assertThat(CallerNamePolicy.isPhoneNumber("+1 (555) 010-0100")).isTrue();
        assertThat(CallerNamePolicy.isPhoneNumber("5550100")).isTrue();
        assertThat(CallerNamePolicy.isPhoneNumber("John 2")).isFalse();
        assertThat(CallerNamePolicy.isPhoneNumber("")).isFalse();
    }

    @Test
    public void choose_fillsEmptyName() {
        assertThat(CallerNamePolicy.choose(null, "John")).isEqualTo("John");
        assertThat(CallerNamePolicy.choose("", "+1 555 0100")).isEqualTo("+1 555 0100");
        assertThat(CallerNamePolicy.choose(null, "\u2066Jane\u2069")).isEqualTo("Jane");
    }

    @Test
    public void choose_placeholderIsReplacedByAnythingConcrete() {
        assertThat(CallerNamePolicy.choose("Incoming Call", "John")).isEqualTo("John");
        assertThat(CallerNamePolicy.choose("Incoming Call", "+1 555 0100"))
                .isEqualTo("+1 555 0100");
        assertThat(CallerNamePolicy.choose("Incoming Call", "Unknown Caller"))
                .isEqualTo("Incoming Call");
    }

    @Test
    public void choose_numberIsReplacedOnlyByName() {
        assertThat(CallerNamePolicy.choose("+1 555 0100", "John")).isEqualTo("John");
        assertThat(CallerNamePolicy.choose("+1 555 0100", "+1 555 0199"))
                .isEqualTo("+1 555 0100");
        assertThat(CallerNamePolicy.choose("+1 555 0100", "Active Call"))
                .isEqualTo("+1 555 0100");
    }

    @Test
    public void choose_concreteNameIsKept() {
        assertThat(CallerNamePolicy.choose("John", "Jane")).isEqualTo("John");
        assertThat(CallerNamePolicy.choose("John", "+1 555 0100")).isEqualTo("John");
        assertThat(CallerNamePolicy.choose("John", "Incoming Call")).isEqualTo("John");
        assertThat(CallerNamePolicy.choose("John", "JOHN")).isEqualTo("John");
    }

    @Test
    public void choose_rejectsDeniedAndBlankCandidates() {
        assertThat(CallerNamePolicy.choose("Incoming Call", "Spam protection disabled"))
                .isEqualTo("Incoming Call");
        assertThat(CallerNamePolicy.choose(null, "Buy premium")).isNull();
        assertThat(CallerNamePolicy.choose("Incoming Call", "   ")).isEqualTo("Incoming Call");
        assertThat(CallerNamePolicy.choose("Incoming Call", null)).isEqualTo("Incoming Call");
    }
}
