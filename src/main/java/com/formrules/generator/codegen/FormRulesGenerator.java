package com.formrules.generator.codegen;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.formrules.generator.codegen.calc.CalculationSynthesizer;
import com.formrules.generator.codegen.collab.DataColumnFieldMetadataService;
import com.formrules.generator.codegen.collab.DefaultNameCanonicalizer;
import com.formrules.generator.codegen.collab.DeploymentException;
import com.formrules.generator.codegen.collab.IdentifierSource;
import com.formrules.generator.codegen.collab.LocalViewDeploymentClient;
import com.formrules.generator.codegen.collab.RandomIdentifierSource;
import com.formrules.generator.codegen.collab.ViewDeploymentClient;
import com.formrules.generator.codegen.heuristics.DefaultFormHeuristics;
import com.formrules.generator.codegen.mapping.FieldMappingBuilder;
import com.formrules.generator.codegen.model.core.context.DiagnosticKind;
import com.formrules.generator.codegen.model.core.context.GenerationContext;
import com.formrules.generator.codegen.model.core.context.GenerationFlags;
import com.formrules.generator.codegen.model.core.context.GenerationStats;
import com.formrules.generator.codegen.model.core.context.GeneratorConfig;
import com.formrules.generator.codegen.model.form.Form;
import com.formrules.generator.codegen.model.form.RepeatingGroup;
import com.formrules.generator.codegen.model.form.View;
import com.formrules.generator.codegen.model.form.ViewIdentifiers;
import com.formrules.generator.codegen.model.form.ViewPair;
import com.formrules.generator.codegen.model.input.FormDocument;
import com.formrules.generator.codegen.model.output.FormOutput;
import com.formrules.generator.codegen.model.output.FormSummary;
import com.formrules.generator.codegen.model.output.GeneratedFile;
import com.formrules.generator.codegen.nesting.NestingResolver;
import com.formrules.generator.codegen.output.ReportRenderer;
import com.formrules.generator.codegen.output.RuleGraphWriter;
import com.formrules.generator.codegen.output.ViewDocumentRenderer;
import com.formrules.generator.codegen.rules.ClearRuleGenerator;
import com.formrules.generator.codegen.rules.NavigationRuleGenerator;
import com.formrules.generator.codegen.rules.RuleGraphAssembler;
import com.formrules.generator.codegen.rules.RuleGraphValidator;
import com.formrules.generator.codegen.rules.RuleNodeFactory;
import com.formrules.generator.codegen.rules.StructuralGapException;
import com.formrules.generator.codegen.rules.SubmitRuleGenerator;
import com.formrules.generator.codegen.rules.VisibilityRuleGenerator;
import com.formrules.generator.codegen.rules.graph.Expression;
import com.formrules.generator.codegen.rules.graph.RuleEvent;
import com.formrules.generator.codegen.rules.graph.RuleGraph;
import com.formrules.generator.codegen.util.FileWriteUtil;
import com.formrules.generator.codegen.view.ViewPlanner;
import com.formrules.generator.parser.FormDefinitionParser;

import freemarker.template.Configuration;
import freemarker.template.TemplateExceptionHandler;

/**
 * Compiles a form definition document into view documents and one rule graph
 * per form.
 */
public class FormRulesGenerator {
    private static final Logger log = LoggerFactory.getLogger(FormRulesGenerator.class);

    private final GeneratorConfig config;
    private final IdentifierSource identifiers;
    private final ViewDeploymentClient deploymentClient;
    private final Configuration freemarkerConfig;

    private final FormDefinitionParser parser = new FormDefinitionParser();
    private final ViewPlanner viewPlanner = new ViewPlanner();
    private final NestingResolver nestingResolver = new NestingResolver();
    private final FieldMappingBuilder fieldMappingBuilder = new FieldMappingBuilder();
    private final CalculationSynthesizer calculationSynthesizer = new CalculationSynthesizer();
    private final RuleGraphValidator validator = new RuleGraphValidator();

    private final RuleGraphAssembler assembler;
    private final NavigationRuleGenerator navigationRules;
    private final ClearRuleGenerator clearRules;
    private final SubmitRuleGenerator submitRules;
    private final VisibilityRuleGenerator visibilityRules;

    private final ViewDocumentRenderer viewRenderer;
    private final RuleGraphWriter ruleGraphWriter = new RuleGraphWriter();
    private final ReportRenderer reportRenderer;

    public FormRulesGenerator(GeneratorConfig config) {
        this(config, new RandomIdentifierSource());
    }

    public FormRulesGenerator(GeneratorConfig config, IdentifierSource identifiers) {
        this(config, identifiers, new LocalViewDeploymentClient(identifiers));
    }

    public FormRulesGenerator(GeneratorConfig config, IdentifierSource identifiers,
                              ViewDeploymentClient deploymentClient) {
        this.config = config;
        this.identifiers = identifiers;
        this.deploymentClient = deploymentClient;
        this.freemarkerConfig = createFreemarkerConfig();

        RuleNodeFactory nodes = new RuleNodeFactory(identifiers);
        this.assembler = new RuleGraphAssembler(identifiers);
        this.navigationRules = new NavigationRuleGenerator(assembler, nodes);
        this.clearRules = new ClearRuleGenerator(assembler, nodes);
        this.submitRules = new SubmitRuleGenerator(assembler, nodes, clearRules);
        this.visibilityRules = new VisibilityRuleGenerator(assembler, nodes);
        this.viewRenderer = new ViewDocumentRenderer(freemarkerConfig);
        this.reportRenderer = new ReportRenderer(freemarkerConfig);
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    /** Registries and diagnostics belong to one run; every call to {@link #generate()} starts empty. */
    private GenerationContext newRunContext() {
        return GenerationContext.builder()
                .config(config)
                .flags(GenerationFlags.from(config))
                .heuristics(new DefaultFormHeuristics(config.getNestingOverrides()))
                .canonicalizer(new DefaultNameCanonicalizer())
                .identifiers(identifiers)
                .deploymentClient(deploymentClient)
                .build();
    }

    /**
     * Run the whole pipeline over every form of the input document.
     */
    public GeneratorResult generate() {
        long started = System.currentTimeMillis();
        GenerationContext context = newRunContext();
        try {
            log.info("Starting rule generation...");

            // Step 1: Parse form definitions
            log.info("Step 1: Parsing form definitions from {}...", config.getInputFile());
            List<FormDocument> documents = parser.parse(config.getInputFile());
            if (documents.isEmpty()) {
                return GeneratorResult.failure("No form definitions found in " + config.getInputFile());
            }

            // Step 2: Plan views, resolve nesting, deploy and build rules per form
            log.info("Step 2: Generating {} form(s)...", documents.size());
            List<FormOutput> outputs = new ArrayList<>();
            for (FormDocument document : documents) {
                outputs.add(generateForm(document, context));
            }

            // Step 3: Render view documents and rule graphs
            log.info("Step 3: Rendering output files...");
            List<GeneratedFile> files = new ArrayList<>();
            Map<String, RuleGraph> graphs = new LinkedHashMap<>();
            for (FormOutput output : outputs) {
                if (output.getGraph() == null) {
                    continue;
                }
                graphs.put(output.getForm().getName(), output.getGraph());
                files.addAll(renderForm(output, context));
            }

            List<FormSummary> summaries = outputs.stream().map(FormOutput::getSummary).toList();
            GenerationStats stats = buildStats(summaries, files.size() + 1, System.currentTimeMillis() - started);

            // Step 4: Render the run report
            log.info("Step 4: Rendering generation report...");
            files.add(reportRenderer.render(config.getInputFile(), config.getOutputDir(), summaries,
                    context.getDiagnostics().getEntries(), stats));

            // Step 5: Write files
            if (context.getFlags().isWriteFiles()) {
                log.info("Step 5: Writing {} file(s) to {}...", files.size(), config.getOutputDir());
                writeFiles(files, graphs.keySet(), context);
            } else {
                log.info("Step 5: Dry run, {} file(s) not written", files.size());
            }

            log.info("Rule generation complete!");

            return GeneratorResult.builder()
                    .success(true)
                    .outputPath(config.getOutputDir())
                    .stats(stats)
                    .forms(new ArrayList<>(summaries))
                    .diagnostics(new ArrayList<>(context.getDiagnostics().getEntries()))
                    .files(files)
                    .ruleGraphs(graphs)
                    .build();

        } catch (Exception e) {
            log.error("Generation failed", e);
            return GeneratorResult.failure(e.getMessage());
        }
    }

    /**
     * Full pipeline for one form. A structural gap aborts this form only.
     */
    private FormOutput generateForm(FormDocument document, GenerationContext context) {
        GenerationContext formContext = context.toBuilder()
                .fieldMetadata(new DataColumnFieldMetadataService(document.getDataColumns(), context.getCanonicalizer()))
                .build();

        Form planned = viewPlanner.plan(document, formContext);
        String formName = planned.getName();
        log.info("Form {}: {} view(s) planned", formName, planned.getViews().size());

        List<RepeatingGroup> resolved = nestingResolver.resolve(planned.getGroups(),
                formContext.getHeuristics().nestingOverrides(),
                !planned.getRootControls().isEmpty(),
                formContext.getDiagnostics(),
                formName);
        Form form = planned.toBuilder().clearGroups().groups(resolved).build();

        deployViews(form, formContext);

        for (ViewPair pair : form.getViewPairs()) {
            pair.setFieldMappings(fieldMappingBuilder.build(pair.getGroupName(),
                    formContext.getControlRegistry().getControls(pair.getItemViewName()),
                    formContext.getControlRegistry().getControls(pair.getListViewName()),
                    formContext.getDiagnostics(),
                    formName));
        }

        RuleGraph graph;
        try {
            graph = assembler.createGraph(form, formContext.newId(), formContext.getControlRegistry());
        } catch (StructuralGapException e) {
            log.error("Form {} aborted: {}", formName, e.getMessage());
            formContext.report(DiagnosticKind.STRUCTURAL_GAP, formName, e.getMessage());
            return new FormOutput(form, null, FormSummary.failed(formName, form.getDisplayName(), e.getMessage()));
        }

        int navigationEvents = navigationRules.generate(form, graph, formContext);
        Optional<RuleEvent> clearEvent = clearRules.generate(form, graph, formContext);
        submitRules.generate(form, graph, formContext, clearEvent);
        int visibilityEvents = visibilityRules.generate(form, graph, formContext);
        List<Expression> expressions = calculationSynthesizer.synthesize(form, graph, formContext);
        int issues = validator.validate(graph, formContext.getDiagnostics(), formName);

        log.info("Form {}: {} navigation event(s), {} visibility event(s), {} expression(s), {} validation issue(s)",
                formName, navigationEvents, visibilityEvents, expressions.size(), issues);

        FormSummary.FormSummaryBuilder summary = FormSummary.builder()
                .formName(formName)
                .displayName(form.getDisplayName())
                .generated(true)
                .viewCount(graph.getLayout().size())
                .viewPairCount((int) form.getViewPairs().stream().filter(ViewPair::isDeployed).count())
                .eventCount((int) graph.events().count())
                .handlerCount(graph.events().mapToInt(e -> e.getHandlers().size()).sum())
                .expressionCount(expressions.size())
                .validationIssues(issues);
        for (RepeatingGroup group : form.getGroups()) {
            summary.groupLine(group.getName() + " (depth " + group.getDepth() + ", parent "
                    + group.getParentName().orElse("-") + ")");
        }
        return new FormOutput(form, graph, summary.build());
    }

    /** Deployment failures are reported per view; the view is left out of the layout. */
    private void deployViews(Form form, GenerationContext formContext) {
        for (View view : form.getViews()) {
            try {
                ViewIdentifiers identifiers = formContext.getDeploymentClient().resolveViewIdentifiers(view.getName());
                formContext.getControlRegistry().registerIdentifiers(view.getName(), identifiers);
                log.debug("View {} deployed as {}", view.getName(), identifiers.getViewId());
            } catch (DeploymentException e) {
                log.error("Deployment of view {} failed: {}", view.getName(), e.getMessage());
                formContext.report(DiagnosticKind.DEPLOYMENT_FAILURE, form.getName(),
                        "View " + view.getName() + " could not be deployed: " + e.getMessage());
            }
        }
        for (ViewPair pair : form.getViewPairs()) {
            formContext.getControlRegistry().getIdentifiers(pair.getItemViewName()).ifPresent(pair::setItemIdentifiers);
            formContext.getControlRegistry().getIdentifiers(pair.getListViewName()).ifPresent(pair::setListIdentifiers);
        }
    }

    private List<GeneratedFile> renderForm(FormOutput output, GenerationContext context) throws IOException {
        Form form = output.getForm();
        Path formDir = config.getOutputDir().resolve(form.getName());

        List<GeneratedFile> files = new ArrayList<>();
        for (View view : form.getViews()) {
            files.add(viewRenderer.render(form.getName(), view,
                    context.getControlRegistry().getIdentifiers(view.getName()), formDir));
        }
        files.add(ruleGraphWriter.render(output.getGraph(), formDir));
        return files;
    }

    private void writeFiles(List<GeneratedFile> files, Iterable<String> formNames, GenerationContext context)
            throws IOException {
        for (String formName : formNames) {
            Path formDir = config.getOutputDir().resolve(formName);
            if (FileWriteUtil.isNonEmptyDirectory(formDir)) {
                if (context.getFlags().isOverwriteExisting()) {
                    FileWriteUtil.deleteDirectory(formDir);
                } else {
                    throw new IOException("Form output directory already exists: " + formDir);
                }
            }
        }
        for (GeneratedFile file : files) {
            FileWriteUtil.safeWriteString(file.getPath(), file.getContents());
            log.debug("Wrote {}", file.getPath());
        }
    }

    private static GenerationStats buildStats(List<FormSummary> summaries, int fileCount, long elapsed) {
        return GenerationStats.builder()
                .formCount(summaries.size())
                .formsFailed((int) summaries.stream().filter(s -> !s.isGenerated()).count())
                .viewCount(summaries.stream().mapToInt(FormSummary::getViewCount).sum())
                .viewPairCount(summaries.stream().mapToInt(FormSummary::getViewPairCount).sum())
                .eventCount(summaries.stream().mapToInt(FormSummary::getEventCount).sum())
                .handlerCount(summaries.stream().mapToInt(FormSummary::getHandlerCount).sum())
                .expressionCount(summaries.stream().mapToInt(FormSummary::getExpressionCount).sum())
                .fileCount(fileCount)
                .generationTimeMillis(elapsed)
                .build();
    }
}
