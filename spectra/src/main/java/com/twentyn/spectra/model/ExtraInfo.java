/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.twentyn.spectra.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Side-channel metadata of one data item: peak shape and multiplicity, references to the structure fragments the
 * peak is assigned to, and free-form details (e.g. coupling constants, widths, comments read by a codec).
 *
 * An ExtraInfo belongs to exactly one item of one section.  Sections hand out the stored instance, so callers that
 * want to keep one beyond the life of its item should {@link #copy()} it.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ExtraInfo {

  @JsonProperty("shape")
  private PeakShape shape;

  @JsonProperty("multiplicity")
  private PeakMultiplicity multiplicity;

  @JsonProperty("assignments")
  private List<String> assignments = new ArrayList<>();

  @JsonProperty("details")
  private Map<String, Object> details = new LinkedHashMap<>();

  public ExtraInfo() {

  }

  public ExtraInfo(PeakShape shape, PeakMultiplicity multiplicity) {
    this.shape = shape;
    this.multiplicity = multiplicity;
  }

  public PeakShape getShape() {
    return shape;
  }

  public ExtraInfo setShape(PeakShape shape) {
    this.shape = shape;
    return this;
  }

  public PeakMultiplicity getMultiplicity() {
    return multiplicity;
  }

  public ExtraInfo setMultiplicity(PeakMultiplicity multiplicity) {
    this.multiplicity = multiplicity;
    return this;
  }

  public List<String> getAssignments() {
    return Collections.unmodifiableList(assignments);
  }

  public ExtraInfo addAssignment(String assignmentRef) {
    assignments.add(assignmentRef);
    return this;
  }

  public ExtraInfo removeAssignment(String assignmentRef) {
    assignments.remove(assignmentRef);
    return this;
  }

  public Map<String, Object> getDetails() {
    return Collections.unmodifiableMap(details);
  }

  public Object getDetail(String key) {
    return details.get(key);
  }

  public ExtraInfo setDetail(String key, Object value) {
    if (value == null) {
      details.remove(key);
    } else {
      details.put(key, value);
    }
    return this;
  }

  /**
   * An ExtraInfo without shape, multiplicity, assignments or details carries no information and is treated as if
   * the item had none.
   */
  @JsonIgnore
  public boolean isEmpty() {
    return shape == null && multiplicity == null && assignments.isEmpty() && details.isEmpty();
  }

  public ExtraInfo copy() {
    ExtraInfo result = new ExtraInfo(shape, multiplicity);
    result.assignments.addAll(assignments);
    result.details.putAll(details);
    return result;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    ExtraInfo that = (ExtraInfo) o;

    if (shape != that.shape) return false;
    if (multiplicity != that.multiplicity) return false;
    if (!assignments.equals(that.assignments)) return false;
    return details.equals(that.details);
  }

  @Override
  public int hashCode() {
    return Objects.hash(shape, multiplicity, assignments, details);
  }

  @Override
  public String toString() {
    return String.format("ExtraInfo{shape=%s, multiplicity=%s, assignments=%s, details=%s}",
        shape, multiplicity, assignments, details);
  }
}
