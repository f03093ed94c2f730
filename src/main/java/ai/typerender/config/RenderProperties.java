package ai.typerender.config;

import ai.typerender.render.DeclarationOrder;
import ai.typerender.render.RenderOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "renderer")
public class RenderProperties {

    private Path input;
    private Path output;
    private Path namesReport;
    private boolean declareUnions = false;
    private DeclarationOrder declarationOrder = DeclarationOrder.TOPOLOGICAL;
    private List<String> leadingComments = new ArrayList<>();

    public Path getInput() {
        return input;
    }

    public void setInput(Path input) {
        this.input = input;
    }

    public Path getOutput() {
        return output;
    }

    public void setOutput(Path output) {
        this.output = output;
    }

    public Path getNamesReport() {
        return namesReport;
    }

    public void setNamesReport(Path namesReport) {
        this.namesReport = namesReport;
    }

    public boolean isDeclareUnions() {
        return declareUnions;
    }

    public void setDeclareUnions(boolean declareUnions) {
        this.declareUnions = declareUnions;
    }

    public DeclarationOrder getDeclarationOrder() {
        return declarationOrder;
    }

    public void setDeclarationOrder(DeclarationOrder declarationOrder) {
        this.declarationOrder = declarationOrder;
    }

    public List<String> getLeadingComments() {
        return leadingComments;
    }

    public void setLeadingComments(List<String> leadingComments) {
        this.leadingComments = leadingComments;
    }

    public RenderOptions toOptions() {
        return new RenderOptions(declareUnions, declarationOrder);
    }
}
