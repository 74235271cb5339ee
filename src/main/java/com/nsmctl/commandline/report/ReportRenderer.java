package com.nsmctl.commandline.report;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders a {@link TabularReport} as a box-drawn grid using the {@code table.ftl} template.
 */
public class ReportRenderer {

    private static final String TEMPLATE = "table.ftl";
    private static final ReportRenderer DEFAULT = new ReportRenderer();

    private final Configuration freemarkerConfig;

    public ReportRenderer() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    public static ReportRenderer getDefault() {
        return DEFAULT;
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

    public String render(TabularReport report) {
        List<String> header = report.getHeaders();
        List<List<String>> rows = new ArrayList<>();
        List<Integer> widths = new ArrayList<>();
        header.forEach(h -> widths.add(h.length()));

        for (List<Object> row : report.getRows()) {
            List<String> cells = new ArrayList<>();
            for (int i = 0; i < row.size(); i++) {
                String cell = String.valueOf(row.get(i));
                cells.add(cell);
                widths.set(i, Math.max(widths.get(i), cell.length()));
            }
            rows.add(cells);
        }

        Map<String, Object> model = new HashMap<>();
        model.put("header", header);
        model.put("rows", rows);
        model.put("widths", widths);

        try {
            Template template = freemarkerConfig.getTemplate(TEMPLATE);
            StringWriter out = new StringWriter();
            template.process(model, out);
            return out.toString().stripTrailing();
        } catch (IOException | TemplateException e) {
            throw new IllegalStateException("Failed to render report with " + TEMPLATE, e);
        }
    }
}
