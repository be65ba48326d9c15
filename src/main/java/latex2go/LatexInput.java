package latex2go;

public record LatexInput(String latex, TranspilerOptions options) {
}
