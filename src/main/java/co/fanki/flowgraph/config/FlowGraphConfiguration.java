package co.fanki.flowgraph.config;

import co.fanki.flowgraph.cfg.domain.CfgBuilder;
import co.fanki.flowgraph.cfg.domain.ConstructTranslator;
import co.fanki.flowgraph.cfg.domain.FlowAnalyzer;
import co.fanki.flowgraph.cfg.domain.GraphValidator;
import co.fanki.flowgraph.export.domain.ExportAdapters;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the graph engine.
 *
 * <p>Additional constructs are registered by declaring
 * {@link ConstructTranslator} beans named after the AST type tag they
 * translate, e.g. a bean named {@code switch_statement}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class FlowGraphConfiguration {

    /**
     * Creates the graph builder with every translator bean registered.
     *
     * @param beanFactory the bean factory holding the translators
     * @return the builder
     */
    @Bean
    public CfgBuilder cfgBuilder(final ListableBeanFactory beanFactory) {
        return new CfgBuilder(
                beanFactory.getBeansOfType(ConstructTranslator.class));
    }

    /**
     * Creates the graph validator.
     *
     * @return the validator
     */
    @Bean
    public GraphValidator graphValidator() {
        return new GraphValidator();
    }

    /**
     * Creates the flow analyzer.
     *
     * @param graphValidator the validator computing reachability
     * @return the analyzer
     */
    @Bean
    public FlowAnalyzer flowAnalyzer(final GraphValidator graphValidator) {
        return new FlowAnalyzer(graphValidator);
    }

    /**
     * Creates the export adapter registry.
     *
     * @return the Mermaid, DOT and JSON adapters
     */
    @Bean
    public ExportAdapters exportAdapters() {
        return ExportAdapters.defaults();
    }

}
