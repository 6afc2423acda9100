package org.zen.logic.verifier;

import java.util.List;

import org.apache.commons.lang.StringUtils;
import org.zen.logic.formula.FormulaRenderer;
import org.zen.logic.formula.grammar.Formula;
import org.zen.logic.kb.exceptions.ProofIncompleteException;

/**
 * Renders verified proofs for humans.  Only proofs in the {@link ProofState#VERIFIED_VALID} state can be exported.
 */
public final class ProofExporter
{
  private static final String NEWLINE = "\n";

  private ProofExporter()
  {
  }

  /**
   * @see #export(Proof, Formula, ExportFormat)
   */
  public static String export(Proof xiProof, ExportFormat xiFormat) throws ProofIncompleteException
  {
    return export(xiProof, null, xiFormat);
  }

  /**
   * Export a proof.
   *
   * @param xiProof - the proof.
   * @param xiStatement - the statement proven, or null to leave it out.
   * @param xiFormat - the output format.
   *
   * @return the exported proof.
   * @throws ProofIncompleteException if the proof has not been verified as valid.
   */
  public static String export(Proof xiProof, Formula xiStatement, ExportFormat xiFormat)
    throws ProofIncompleteException
  {
    if (!xiProof.isValid())
    {
      throw new ProofIncompleteException(xiProof.getTheoremName());
    }

    StringBuilder sb = new StringBuilder();
    switch (xiFormat)
    {
      case MARKDOWN: exportMarkdown(sb, xiProof, xiStatement); break;
      case LATEX:    exportLatex(sb, xiProof, xiStatement);    break;
      case TEXT:     exportText(sb, xiProof, xiStatement);     break;
      default:       throw new IllegalArgumentException("Unknown export format: " + xiFormat);
    }
    return sb.toString();
  }

  private static void exportMarkdown(StringBuilder xiBuilder, Proof xiProof, Formula xiStatement)
  {
    xiBuilder.append("## Proof of `").append(xiProof.getTheoremName()).append('`').append(NEWLINE).append(NEWLINE);
    if (xiStatement != null)
    {
      xiBuilder.append("**Theorem:** `").append(FormulaRenderer.render(xiStatement)).append('`');
      xiBuilder.append(NEWLINE).append(NEWLINE);
    }

    xiBuilder.append("| # | Step | Justification |").append(NEWLINE);
    xiBuilder.append("|---|------|---------------|").append(NEWLINE);

    List<Formula> lSteps = xiProof.getSteps();
    List<Formula> lJustifications = xiProof.getJustifications();
    for (int lii = 0; lii < lSteps.size(); lii++)
    {
      xiBuilder.append("| ").append(lii + 1)
               .append(" | ").append(markdownCell(lSteps.get(lii)))
               .append(" | ").append(markdownCell(lJustifications.get(lii)))
               .append(" |").append(NEWLINE);
    }

    xiBuilder.append(NEWLINE).append("∎").append(NEWLINE);
  }

  private static String markdownCell(Formula xiFormula)
  {
    return StringUtils.replace(FormulaRenderer.render(xiFormula), "|", "\\|");
  }

  private static void exportLatex(StringBuilder xiBuilder, Proof xiProof, Formula xiStatement)
  {
    if (xiStatement != null)
    {
      xiBuilder.append("\\begin{theorem}[").append(latexText(xiProof.getTheoremName())).append("]").append(NEWLINE);
      xiBuilder.append("$").append(FormulaRenderer.renderLatex(xiStatement)).append("$").append(NEWLINE);
      xiBuilder.append("\\end{theorem}").append(NEWLINE);
    }

    xiBuilder.append("\\begin{proof}").append(NEWLINE);
    xiBuilder.append("\\begin{enumerate}").append(NEWLINE);

    List<Formula> lSteps = xiProof.getSteps();
    List<Formula> lJustifications = xiProof.getJustifications();
    for (int lii = 0; lii < lSteps.size(); lii++)
    {
      xiBuilder.append("  \\item $").append(FormulaRenderer.renderLatex(lSteps.get(lii)))
               .append("$ \\hfill $").append(FormulaRenderer.renderLatex(lJustifications.get(lii)))
               .append("$").append(NEWLINE);
    }

    xiBuilder.append("\\end{enumerate}").append(NEWLINE);
    xiBuilder.append("\\end{proof}").append(NEWLINE);
  }

  private static String latexText(String xiText)
  {
    return StringUtils.replace(xiText, "_", "\\_");
  }

  private static void exportText(StringBuilder xiBuilder, Proof xiProof, Formula xiStatement)
  {
    xiBuilder.append("Proof of ").append(xiProof.getTheoremName());
    if (xiStatement != null)
    {
      xiBuilder.append(": ").append(FormulaRenderer.render(xiStatement));
    }
    xiBuilder.append(NEWLINE);

    List<Formula> lSteps = xiProof.getSteps();
    List<Formula> lJustifications = xiProof.getJustifications();
    for (int lii = 0; lii < lSteps.size(); lii++)
    {
      xiBuilder.append(StringUtils.leftPad(Integer.toString(lii + 1), 4)).append(". ")
               .append(FormulaRenderer.render(lSteps.get(lii)))
               .append("  [").append(FormulaRenderer.render(lJustifications.get(lii))).append("]")
               .append(NEWLINE);
    }

    xiBuilder.append("QED").append(NEWLINE);
  }
}
