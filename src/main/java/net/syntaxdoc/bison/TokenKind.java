// Copyright 2026 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package net.syntaxdoc.bison;

/** A TokenKind represents the kind of a Bison grammar token. */
enum TokenKind {
  ACTION("action"),
  BRACKET("named reference"),
  CHAR("character literal"),
  COLON(":"),
  DIRECTIVE("directive"),
  DOC_COMMENT("doc comment"),
  DOC_TOKEN("'%token' command"),
  EOF("EOF"),
  IDENTIFIER("identifier"),
  ILLEGAL("illegal character"),
  INT("integer"),
  OR("|"),
  PERCENT_PERCENT("%%"),
  PREDICATE("predicate"),
  PROLOGUE("prologue"),
  RULE_NAME("rule name"),
  SEMI(";"),
  STRING("string literal"),
  TAG("type tag");

  private final String name;

  TokenKind(String name) {
    this.name = name;
  }

  @Override
  public String toString() {
    return name;
  }
}
