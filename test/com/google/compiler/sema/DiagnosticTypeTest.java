/*
 * Copyright 2026 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package com.google.compiler.sema;

import static com.google.common.truth.Truth.assertThat;

import com.google.compiler.ast.SourceLoc;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link DiagnosticType} and {@link Diagnostic}. */
@RunWith(JUnit4.class)
public final class DiagnosticTypeTest {

  private static final DiagnosticType UNKNOWN_NAME =
      DiagnosticType.error("TEST_UNKNOWN_NAME", "unknown name ''{0}'' in {1}");

  @Test
  public void testFactoriesSetLevel() {
    assertThat(UNKNOWN_NAME.level).isEqualTo(CheckLevel.ERROR);
    assertThat(DiagnosticType.warning("TEST_W", "w").level).isEqualTo(CheckLevel.WARNING);
    assertThat(DiagnosticType.make("TEST_OFF", CheckLevel.OFF, "off").level)
        .isEqualTo(CheckLevel.OFF);
  }

  @Test
  public void testEqualityIsByKey() {
    DiagnosticType sameKey = DiagnosticType.warning("TEST_UNKNOWN_NAME", "other text");
    assertThat(sameKey).isEqualTo(UNKNOWN_NAME);
    assertThat(sameKey.hashCode()).isEqualTo(UNKNOWN_NAME.hashCode());
    assertThat(DiagnosticType.error("TEST_A", "a")).isLessThan(DiagnosticType.error("TEST_B", "b"));
  }

  @Test
  public void testMessageFormatting() {
    Diagnostic diagnostic = Diagnostic.make(UNKNOWN_NAME, SourceLoc.at(7), "x", "main");

    assertThat(diagnostic.description()).isEqualTo("unknown name 'x' in main");
    assertThat(diagnostic.stmt()).isNull();
    assertThat(diagnostic.getDefaultLevel()).isEqualTo(CheckLevel.ERROR);
    assertThat(diagnostic.format(CheckLevel.WARNING))
        .isEqualTo("WARNING - [TEST_UNKNOWN_NAME] unknown name 'x' in main at @7");
  }

  @Test
  public void testInvalidLocationIsPrinted() {
    Diagnostic diagnostic = Diagnostic.make(UNKNOWN_NAME, SourceLoc.invalid(), "y", "f");
    assertThat(diagnostic.format(CheckLevel.ERROR)).endsWith("at @invalid");
  }

  @Test
  public void testCheckLevelIsOn() {
    assertThat(CheckLevel.ERROR.isOn()).isTrue();
    assertThat(CheckLevel.WARNING.isOn()).isTrue();
    assertThat(CheckLevel.OFF.isOn()).isFalse();
  }
}
