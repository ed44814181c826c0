package com.viewsync.generator.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.viewsync.generator.codegen.config.BindingMode;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the "generate" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class GenerateOptions {

	@Parameters(arity = "1..*", paramLabel = "OUTLINE", description = "Template outline files to generate views for")
	private List<Path> outlineFiles = new ArrayList<>();

	@Option(names = { "--output-dir", "-o" }, description = "Source root the views are written to (defaults to current directory)")
	private Path outputDir;

	@Option(names = { "--root", "-r" }, description = "Only generate these roots (repeatable)")
	private List<String> roots = new ArrayList<>();

	@Option(names = { "--namespace", "-n" }, defaultValue = "", description = "Package of the generated views")
	private String namespace;

	@Option(names = { "--base-type" }, defaultValue = "ui.ViewBehaviour", description = "Superclass of the generated views, empty for none")
	private String baseType;

	@Option(names = {
			"--binding-mode" }, defaultValue = "EXPLICIT_INIT", description = "How fields are populated: EXPLICIT_INIT or DECLARATIVE_REFERENCE")
	private BindingMode bindingMode;

	@Option(names = { "--no-auto-include" }, description = "Only bind marked nodes")
	private boolean noAutoInclude;

	@Option(names = { "--extended-controls" }, description = "Also auto-include scroll views, scrollbars and dropdowns")
	private boolean extendedControls;

	@Option(names = { "--prefix" }, description = "Field prefix for a type, e.g. ui.Button=btn (repeatable, overrides the default table)")
	private List<String> prefixes = new ArrayList<>();

	@Option(names = { "--no-prefix" }, description = "Do not prefix field names")
	private boolean noPrefix;

	@Option(names = { "--no-underscore-camel-case" }, description = "Keep field names as derived instead of _camelCase")
	private boolean noUnderscoreCamelCase;

	@Option(names = { "--properties" }, description = "Generate a read-only accessor per field")
	private boolean properties;

	@Option(names = { "--keep-prefix-in-properties" }, description = "Do not strip type prefixes from accessor names")
	private boolean keepPrefixInProperties;

	@Option(names = { "--allow-lowercase-class-names" }, description = "Accept roots whose name starts with a lowercase letter")
	private boolean allowLowercaseClassNames;

	@Option(names = { "--init-method" }, defaultValue = "onBind", description = "Name of the generated lookup method")
	private String initMethod;

	@Option(names = {
			"--persisted-annotation" }, defaultValue = "Persisted", description = "Annotation on fields in DECLARATIVE_REFERENCE mode, empty for none")
	private String persistedAnnotation;

	@Option(names = { "--no-attach" }, description = "Do not attach generated views to their roots")
	private boolean noAttach;

	@Option(names = { "--quiet-recovery" }, description = "Do not log re-inserted marker regions")
	private boolean quietRecovery;

	@Option(names = { "--list-fields" }, description = "Print the fields of each root and exit without generating")
	private boolean listFields;

	@Option(names = { "--dry-run" }, description = "Report what would change without writing files")
	private boolean dryRun;

	// ---- Getters (no setters needed; picocli sets fields reflectively) ----

}
