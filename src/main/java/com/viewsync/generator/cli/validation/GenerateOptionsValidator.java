package com.viewsync.generator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import com.viewsync.generator.cli.exception.OptionsValidationException;
import com.viewsync.generator.cli.model.GenerateOptions;
import com.viewsync.generator.cli.model.ValidatedGenerateOptions;
import com.viewsync.generator.codegen.config.GenerationSettings;
import com.viewsync.generator.codegen.config.TypePrefix;

public class GenerateOptionsValidator {

	private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");
	private static final Pattern QUALIFIED_NAME = Pattern
			.compile("^[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*$");

	public ValidatedGenerateOptions validate(GenerateOptions o) {
		List<String> errors = new ArrayList<>();

		List<Path> outlineFiles = o.getOutlineFiles() == null ? List.of() : List.copyOf(o.getOutlineFiles());
		if (outlineFiles.isEmpty()) {
			errors.add("At least one template outline file is required.");
		}
		for (Path file : outlineFiles) {
			if (!Files.isRegularFile(file)) {
				errors.add("Outline file does not exist or is not a file: " + file);
			}
		}

		if (!isBlank(o.getNamespace()) && !QUALIFIED_NAME.matcher(o.getNamespace().trim()).matches()) {
			errors.add("Namespace is not a valid package name: " + o.getNamespace());
		}
		if (!isBlank(o.getBaseType()) && !QUALIFIED_NAME.matcher(o.getBaseType().trim()).matches()) {
			errors.add("Base type is not a valid type name: " + o.getBaseType());
		}
		if (isBlank(o.getInitMethod()) || !IDENTIFIER.matcher(o.getInitMethod().trim()).matches()) {
			errors.add("Init method is not a valid method name: " + o.getInitMethod());
		}
		if (!isBlank(o.getPersistedAnnotation())
				&& !QUALIFIED_NAME.matcher(o.getPersistedAnnotation().trim()).matches()) {
			errors.add("Persisted annotation is not a valid type name: " + o.getPersistedAnnotation());
		}

		List<TypePrefix> typePrefixes = parsePrefixes(o.getPrefixes(), errors);

		// Normalize output dir
		Path normalizedOutputDir = (o.getOutputDir() == null ? Path.of(".") : o.getOutputDir()).toAbsolutePath()
				.normalize();
		if (Files.exists(normalizedOutputDir) && !Files.isDirectory(normalizedOutputDir)) {
			errors.add("Output directory is not a directory: " + normalizedOutputDir);
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		GenerationSettings settings = GenerationSettings.builder()
				.autoIncludeCommonControls(!o.isNoAutoInclude())
				.autoIncludeExtendedControls(o.isExtendedControls())
				.typePrefixes(typePrefixes)
				.usePrefixForFields(!o.isNoPrefix())
				.underscoreCamelCase(!o.isNoUnderscoreCamelCase())
				.generateProperties(o.isProperties())
				.stripPrefixInPropertyNames(!o.isKeepPrefixInProperties())
				.requireUppercaseClassName(!o.isAllowLowercaseClassNames())
				.bindingMode(o.getBindingMode())
				.namespace(trimToEmpty(o.getNamespace()))
				.baseType(trimToEmpty(o.getBaseType()))
				.initMethodName(o.getInitMethod().trim())
				.persistedFieldAnnotation(trimToEmpty(o.getPersistedAnnotation()))
				.attachAfterGenerate(!o.isNoAttach())
				.logMarkerRecovery(!o.isQuietRecovery())
				.build();

		return new ValidatedGenerateOptions(normalizedOutputDir, outlineFiles, settings);
	}

	/**
	 * Overrides go first, then the default rows for every type not overridden.
	 */
	private static List<TypePrefix> parsePrefixes(List<String> raw, List<String> errors) {
		if (raw == null || raw.isEmpty()) {
			return GenerationSettings.defaultPrefixes();
		}

		Map<String, String> overrides = new LinkedHashMap<>();
		for (String entry : raw) {
			int eq = entry.indexOf('=');
			String type = eq < 0 ? "" : entry.substring(0, eq).trim();
			String prefix = eq < 0 ? "" : entry.substring(eq + 1).trim();
			if (!QUALIFIED_NAME.matcher(type).matches()) {
				errors.add("Prefix entry must look like type=prefix: " + entry);
			} else if (!prefix.isEmpty() && !IDENTIFIER.matcher(prefix).matches()) {
				errors.add("Prefix is not a valid identifier: " + entry);
			} else {
				overrides.put(type, prefix);
			}
		}

		List<TypePrefix> result = new ArrayList<>();
		overrides.forEach((type, prefix) -> result.add(TypePrefix.of(type, prefix)));
		for (TypePrefix row : GenerationSettings.defaultPrefixes()) {
			if (!overrides.containsKey(row.getTypeName())) {
				result.add(row);
			}
		}
		return result;
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}

	private static String trimToEmpty(String s) {
		return s == null ? "" : s.trim();
	}
}
