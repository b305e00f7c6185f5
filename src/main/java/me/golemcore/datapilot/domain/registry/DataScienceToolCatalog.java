package me.golemcore.datapilot.domain.registry;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.datapilot.domain.model.ParameterType;
import me.golemcore.datapilot.domain.model.PipelineStage;
import me.golemcore.datapilot.domain.model.ToolDescriptor;
import me.golemcore.datapilot.domain.model.ToolParameter;
import me.golemcore.datapilot.domain.model.ToolSideEffects;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Built-in analysis tools. Each entry point names a callable inside the
 * sandbox runner; the algorithms themselves live there.
 */
@Component
public class DataScienceToolCatalog implements ToolCatalog {

    static final String DATASET = "dataset";
    static final String MODEL = "model";

    private static final List<String> TASK_TYPES = List.of("classification", "regression", "survival");

    @Override
    public List<ToolDescriptor> descriptors() {
        return List.of(
                datasetProfile(),
                descriptiveStatistics(),
                exploratoryDataAnalysis(),
                dataSuiteInsights(),
                hyperImputeImputation(),
                featureSelection(),
                outlierRemoval(),
                autoPromptModelSearch("AutoPromptClassification", "classification",
                        "Search for the best classification pipeline (AutoPrompt) and save the trained model"),
                autoPromptModelSearch("AutoPromptRegression", "regression",
                        "Search for the best regression pipeline (AutoPrompt) and save the trained model"),
                autoPromptSurvival(),
                explainer("ShapExplainer", "explain.shap:shap_explainer",
                        "Explain the trained model with SHAP values and save bar and beeswarm plots"),
                explainer("PermutationExplainer", "explain.permutation:permutation_explainer",
                        "Explain the trained model with permutation feature importance"));
    }

    private ToolDescriptor datasetProfile() {
        return ToolDescriptor.builder()
                .name("DatasetProfile")
                .description("Check an uploaded data file: shape, column types, and whether it can be loaded")
                .parameter(datasetParameter())
                .sideEffects(ToolSideEffects.builder()
                        .read(DATASET)
                        .stage(PipelineStage.INGEST)
                        .build())
                .entryPoint("ingest.profile:dataset_profile")
                .build();
    }

    private ToolDescriptor descriptiveStatistics() {
        return ToolDescriptor.builder()
                .name("DescriptiveStatistics")
                .description("Summary statistics per column, normality checks and detection of categorical columns")
                .parameter(datasetParameter())
                .sideEffects(ToolSideEffects.builder()
                        .read(DATASET)
                        .stage(PipelineStage.EXPLORE)
                        .build())
                .entryPoint("explore.descriptive_stats:descriptive_statistics")
                .build();
    }

    private ToolDescriptor exploratoryDataAnalysis() {
        return ToolDescriptor.builder()
                .name("ExploratoryDataAnalysis")
                .description("Exploratory data analysis: missing values, correlations, outliers and duplicates")
                .parameter(datasetParameter())
                .parameter(targetColumn(false))
                .sideEffects(ToolSideEffects.builder()
                        .read(DATASET)
                        .stage(PipelineStage.EXPLORE)
                        .build())
                .entryPoint("explore.eda:exploratory_data_analysis")
                .build();
    }

    private ToolDescriptor dataSuiteInsights() {
        return ToolDescriptor.builder()
                .name("DataSuiteInsights")
                .description("Data-centric insights: flag features and samples whose values look inconsistent "
                        + "with the rest of the data")
                .parameter(datasetParameter())
                .parameter(targetColumn(true))
                .sideEffects(ToolSideEffects.builder()
                        .read(DATASET)
                        .stage(PipelineStage.EXPLORE)
                        .build())
                .entryPoint("explore.data_suite:data_suite_insights")
                .timeout(Duration.ofMinutes(30))
                .build();
    }

    private ToolDescriptor hyperImputeImputation() {
        return ToolDescriptor.builder()
                .name("HyperImputeImputation")
                .description("Impute missing values with HyperImpute and save the imputed dataset as a new version")
                .parameter(datasetParameter())
                .parameter(targetColumn(false))
                .parameter(ToolParameter.builder()
                        .name("method")
                        .type(ParameterType.ENUM)
                        .description("Imputation method")
                        .allowedValue("hyperimpute")
                        .allowedValue("mean")
                        .allowedValue("median")
                        .allowedValue("most_frequent")
                        .allowedValue("mice")
                        .allowedValue("missforest")
                        .defaultValue("hyperimpute")
                        .build())
                .sideEffects(ToolSideEffects.builder()
                        .read(DATASET)
                        .write(DATASET)
                        .stage(PipelineStage.ENGINEER)
                        .build())
                .entryPoint("engineer.imputation:hyperimpute_imputation")
                .timeout(Duration.ofMinutes(30))
                .build();
    }

    private ToolDescriptor featureSelection() {
        return ToolDescriptor.builder()
                .name("FeatureSelection")
                .description("Select the most informative features for the target and save the reduced dataset")
                .parameter(datasetParameter())
                .parameter(targetColumn(true))
                .parameter(taskType(true))
                .parameter(ToolParameter.builder()
                        .name("max_features")
                        .type(ParameterType.INTEGER)
                        .description("Upper bound on the number of features kept")
                        .minimum(1.0)
                        .maximum(10_000.0)
                        .build())
                .sideEffects(ToolSideEffects.builder()
                        .read(DATASET)
                        .write(DATASET)
                        .stage(PipelineStage.ENGINEER)
                        .build())
                .entryPoint("engineer.feature_selection:feature_selection")
                .build();
    }

    private ToolDescriptor outlierRemoval() {
        return ToolDescriptor.builder()
                .name("OutlierRemoval")
                .description("Remove rows with outlying values in the given numeric columns")
                .parameter(datasetParameter())
                .parameter(ToolParameter.builder()
                        .name("columns")
                        .type(ParameterType.STRING_LIST)
                        .required(true)
                        .description("Numeric columns to check")
                        .build())
                .parameter(ToolParameter.builder()
                        .name("method")
                        .type(ParameterType.ENUM)
                        .allowedValue("iqr")
                        .allowedValue("zscore")
                        .defaultValue("iqr")
                        .build())
                .parameter(ToolParameter.builder()
                        .name("threshold")
                        .type(ParameterType.NUMBER)
                        .description("IQR multiplier or z-score cut-off")
                        .minimum(0.5)
                        .maximum(10.0)
                        .defaultValue(1.5)
                        .build())
                .sideEffects(ToolSideEffects.builder()
                        .read(DATASET)
                        .write(DATASET)
                        .stage(PipelineStage.ENGINEER)
                        .build())
                .entryPoint("engineer.outliers:outlier_removal")
                .build();
    }

    private ToolDescriptor autoPromptModelSearch(String name, String task, String description) {
        return ToolDescriptor.builder()
                .name(name)
                .description(description)
                .parameter(datasetParameter())
                .parameter(targetColumn(true))
                .parameter(timeBudget())
                .sideEffects(ToolSideEffects.builder()
                        .read(DATASET)
                        .write(MODEL)
                        .stage(PipelineStage.MODEL)
                        .build())
                .entryPoint("model.autoprompt:" + task)
                .timeout(Duration.ofHours(1))
                .build();
    }

    private ToolDescriptor autoPromptSurvival() {
        return ToolDescriptor.builder()
                .name("AutoPromptSurvival")
                .description("Search for the best survival analysis pipeline (AutoPrompt) and save the trained model")
                .parameter(datasetParameter())
                .parameter(ToolParameter.builder()
                        .name("time_column")
                        .type(ParameterType.STRING)
                        .required(true)
                        .description("Column holding the time to event or censoring")
                        .build())
                .parameter(ToolParameter.builder()
                        .name("event_column")
                        .type(ParameterType.STRING)
                        .required(true)
                        .description("Column holding the event indicator")
                        .build())
                .parameter(timeBudget())
                .sideEffects(ToolSideEffects.builder()
                        .read(DATASET)
                        .write(MODEL)
                        .stage(PipelineStage.MODEL)
                        .build())
                .entryPoint("model.autoprompt:survival")
                .timeout(Duration.ofHours(1))
                .build();
    }

    private ToolDescriptor explainer(String name, String entryPoint, String description) {
        return ToolDescriptor.builder()
                .name(name)
                .description(description)
                .parameter(datasetParameter())
                .parameter(ToolParameter.builder()
                        .name(MODEL)
                        .type(ParameterType.ARTIFACT)
                        .description("Trained model to explain")
                        .artifactName(MODEL)
                        .defaultValue(MODEL + "@latest")
                        .build())
                .parameter(targetColumn(true))
                .parameter(taskType(false))
                .sideEffects(ToolSideEffects.builder()
                        .read(DATASET)
                        .read(MODEL)
                        .requiresTrainedModel(true)
                        .stage(PipelineStage.EXPLAIN)
                        .build())
                .entryPoint(entryPoint)
                .timeout(Duration.ofMinutes(30))
                .build();
    }

    private static ToolParameter datasetParameter() {
        return ToolParameter.builder()
                .name("dataset")
                .type(ParameterType.ARTIFACT)
                .description("Dataset to use")
                .artifactName(DATASET)
                .defaultValue(DATASET + "@latest")
                .build();
    }

    private static ToolParameter targetColumn(boolean required) {
        return ToolParameter.builder()
                .name("target_column")
                .type(ParameterType.STRING)
                .required(required)
                .description("Name of the target column")
                .build();
    }

    private static ToolParameter taskType(boolean required) {
        return ToolParameter.builder()
                .name("task_type")
                .type(ParameterType.ENUM)
                .required(required)
                .description("Prediction task")
                .allowedValues(TASK_TYPES)
                .build();
    }

    private static ToolParameter timeBudget() {
        return ToolParameter.builder()
                .name("time_budget_minutes")
                .type(ParameterType.INTEGER)
                .description("Search time budget in minutes")
                .minimum(1.0)
                .maximum(240.0)
                .defaultValue(20L)
                .build();
    }
}
