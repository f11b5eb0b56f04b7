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

package com.twentyn.spectra.io;

/**
 * A JSON snapshot of a spectrum dataset: its variables, parameters and sections with their raw items, side tables
 * and settings.  Omitted values are written as null.  Used to hand datasets to the command line tools and to
 * reconstruct them in tests; it makes no promise of stability across versions.
 *
 * Example:
 * <pre>
 {
   "variables" : [ {
     "symbol" : "X",
     "dependency" : "INDEPENDENT",
     "internal_unit" : "Hz",
     "external_unit" : "ppm"
   }, {
     "symbol" : "Y",
     "dependency" : "DEPENDENT",
     "internal_unit" : "arbitrary"
   } ],
   "parameters" : {
     "ObserveFrequency" : { "value" : 400.0, "unit" : "MHz" }
   },
   "active_section" : 0,
   "sections" : [ {
     "name" : "section0",
     "mode" : "PEAK",
     "variables" : [ "X", "Y" ],
     "items" : [ [ 400.0, 10.0 ], [ 800.0, null ] ],
     "extra_infos" : [ { "multiplicity" : "DOUBLET" }, null ],
     "peak_roots" : { "Y" : 0.0 }
   } ]
 }
 </pre>
 */

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.twentyn.spectra.model.ContinuousRange;
import com.twentyn.spectra.model.DataMode;
import com.twentyn.spectra.model.DataSection;
import com.twentyn.spectra.model.ExtraInfo;
import com.twentyn.spectra.model.ItemInput;
import com.twentyn.spectra.model.SpectrumData;
import com.twentyn.spectra.model.SpectrumParameter;
import com.twentyn.spectra.model.ValueRange;
import com.twentyn.spectra.model.VariableDefinition;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class SpectrumInterchangeModel {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SpectrumInterchangeModel.class);

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  static {
    OBJECT_MAPPER.enable(SerializationFeature.INDENT_OUTPUT);
  }

  @JsonProperty("variables")
  private List<VariableDefinition> variables = new ArrayList<>();

  @JsonProperty("parameters")
  private Map<String, SpectrumParameter> parameters = new LinkedHashMap<>();

  @JsonProperty("default_mode")
  private DataMode defaultMode;

  @JsonProperty("active_section")
  private Integer activeSection;

  @JsonProperty("sections")
  private List<SectionEntry> sections = new ArrayList<>();

  // For deserialization.
  protected SpectrumInterchangeModel() {

  }

  public static SpectrumInterchangeModel fromSpectrumData(SpectrumData data) {
    SpectrumInterchangeModel model = new SpectrumInterchangeModel();
    model.variables.addAll(data.getVariables());
    model.parameters.putAll(data.getParameters());
    model.defaultMode = data.getDefaultMode();
    model.activeSection = data.getSectionCount() == 0 ? null : data.getActiveSectionIndex();
    for (DataSection section : data.getSections()) {
      model.sections.add(SectionEntry.fromSection(section));
    }
    return model;
  }

  /**
   * Build a new dataset holding everything this snapshot describes.
   * @throws com.twentyn.spectra.SpectrumConfigurationException if the snapshot is inconsistent, e.g. a section uses
   * an undeclared variable or an item has the wrong length.
   */
  public SpectrumData toSpectrumData() {
    SpectrumData data = new SpectrumData(variables);
    for (Map.Entry<String, SpectrumParameter> entry : parameters.entrySet()) {
      data.setParameter(entry.getKey(), entry.getValue());
    }
    if (defaultMode != null) {
      data.setDefaultMode(defaultMode);
    }
    for (SectionEntry entry : sections) {
      entry.addTo(data);
    }
    if (activeSection != null && activeSection < data.getSectionCount()) {
      data.setActiveSectionIndex(activeSection);
    }
    LOGGER.debug("Rebuilt dataset with %d variables and %d sections", variables.size(), sections.size());
    return data;
  }

  public List<VariableDefinition> getVariables() {
    return variables;
  }

  public Map<String, SpectrumParameter> getParameters() {
    return parameters;
  }

  public List<SectionEntry> getSections() {
    return sections;
  }

  public String writeToJsonString() throws IOException {
    return OBJECT_MAPPER.writeValueAsString(this);
  }

  public void writeToJsonFile(File outputFile) throws IOException {
    try (BufferedWriter writer = new BufferedWriter(
        new OutputStreamWriter(new FileOutputStream(outputFile), StandardCharsets.UTF_8))) {
      OBJECT_MAPPER.writeValue(writer, this);
    }
  }

  public static SpectrumInterchangeModel loadFromJsonString(String json) throws IOException {
    return OBJECT_MAPPER.readValue(json, SpectrumInterchangeModel.class);
  }

  public static SpectrumInterchangeModel loadFromJsonFile(File inputFile) throws IOException {
    return OBJECT_MAPPER.readValue(inputFile, SpectrumInterchangeModel.class);
  }

  @JsonInclude(JsonInclude.Include.NON_EMPTY)
  public static class SectionEntry {
    @JsonProperty("name")
    private String name;

    @JsonProperty("title")
    private String title;

    @JsonProperty("mode")
    private DataMode mode;

    @JsonProperty("variables")
    private List<String> variables = new ArrayList<>();

    @JsonProperty("peak_match_tolerance")
    private Double peakMatchTolerance;

    @JsonProperty("items")
    private List<List<Double>> items = new ArrayList<>();

    // Parallel to items; null where an item has no extra info.
    @JsonProperty("extra_infos")
    private List<ExtraInfo> extraInfos = new ArrayList<>();

    @JsonProperty("continuous_ranges")
    private Map<String, ContinuousRange> continuousRanges = new LinkedHashMap<>();

    @JsonProperty("default_values")
    private Map<String, Double> defaultValues = new LinkedHashMap<>();

    @JsonProperty("peak_roots")
    private Map<String, Double> peakRoots = new LinkedHashMap<>();

    @JsonProperty("display_ranges")
    private Map<String, ValueRange> displayRanges = new LinkedHashMap<>();

    // For deserialization.
    protected SectionEntry() {

    }

    static SectionEntry fromSection(DataSection section) {
      SectionEntry entry = new SectionEntry();
      entry.name = section.getName();
      entry.title = section.getTitle();
      entry.mode = section.getMode();
      entry.variables.addAll(section.getLocalVarSymbols());
      if (section.getPeakMatchTolerance() != DataSection.DEFAULT_TOLERANCE) {
        entry.peakMatchTolerance = section.getPeakMatchTolerance();
      }

      boolean anyExtraInfo = false;
      for (int i = 0; i < section.getItemCount(); i++) {
        double[] raw = section.getRawItemAt(i);
        List<Double> values = new ArrayList<>(raw.length);
        for (double v : raw) {
          values.add(Double.isNaN(v) ? null : v);
        }
        entry.items.add(values);

        ExtraInfo extraInfo = section.getExtraInfoAt(i);
        entry.extraInfos.add(extraInfo == null || extraInfo.isEmpty() ? null : extraInfo);
        anyExtraInfo |= extraInfo != null && !extraInfo.isEmpty();
      }
      if (!anyExtraInfo) {
        entry.extraInfos.clear();
      }

      entry.continuousRanges.putAll(section.getContinuousVarRanges());
      entry.defaultValues.putAll(section.getDefaultVarValues());
      entry.peakRoots.putAll(section.getPeakRootValues());
      entry.displayRanges.putAll(section.getDisplayRanges());
      return entry;
    }

    void addTo(SpectrumData data) {
      DataSection section = data.createSection(variables, mode == null ? data.getDefaultMode() : mode);
      if (name != null) {
        section.setName(name);
      }
      section.setTitle(title);
      if (peakMatchTolerance != null) {
        section.setPeakMatchTolerance(peakMatchTolerance);
      }
      for (Map.Entry<String, ContinuousRange> e : continuousRanges.entrySet()) {
        section.setContinuousVarRange(e.getKey(), e.getValue().getFromValue(), e.getValue().getToValue());
      }
      for (Map.Entry<String, Double> e : defaultValues.entrySet()) {
        section.setDefaultVarValue(e.getKey(), e.getValue());
      }
      for (Map.Entry<String, Double> e : peakRoots.entrySet()) {
        section.setPeakRootValue(e.getKey(), e.getValue());
      }
      for (Map.Entry<String, ValueRange> e : displayRanges.entrySet()) {
        section.setDisplayRange(e.getKey(), e.getValue());
      }

      for (int i = 0; i < items.size(); i++) {
        List<Double> values = items.get(i);
        double[] raw = new double[values.size()];
        for (int j = 0; j < raw.length; j++) {
          Double v = values.get(j);
          raw[j] = v == null ? Double.NaN : v;
        }
        ExtraInfo extraInfo = i < extraInfos.size() ? extraInfos.get(i) : null;
        section.appendItem(ItemInput.of(raw), extraInfo);
      }
    }

    public String getName() {
      return name;
    }

    public DataMode getMode() {
      return mode;
    }

    public List<String> getVariables() {
      return variables;
    }

    public List<List<Double>> getItems() {
      return items;
    }

    public List<ExtraInfo> getExtraInfos() {
      return extraInfos;
    }
  }
}
