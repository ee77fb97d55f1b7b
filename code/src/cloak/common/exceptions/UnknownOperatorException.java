/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package cloak.common.exceptions;

/**
 * The front end asked for a builtin operator that is not in the catalog
 */
public class UnknownOperatorException extends UserException {

  private final String symbol;

  public UnknownOperatorException(String symbol) {
    super(symbol + " is not a known built-in function");
    this.symbol = symbol;
  }

  public String getSymbol() {
    return symbol;
  }

  private static final long serialVersionUID = 1L;
}
