package exm.qua.ir.tree;

import exm.qua.ir.tree.Conditionals.IfStatement;
import exm.qua.ir.tree.IRInstructions.AdvanceInputStream;
import exm.qua.ir.tree.IRInstructions.Align;
import exm.qua.ir.tree.IRInstructions.Assign;
import exm.qua.ir.tree.IRInstructions.FastFrameRotation;
import exm.qua.ir.tree.IRInstructions.Measure;
import exm.qua.ir.tree.IRInstructions.Pause;
import exm.qua.ir.tree.IRInstructions.Play;
import exm.qua.ir.tree.IRInstructions.RampToZero;
import exm.qua.ir.tree.IRInstructions.ResetFrame;
import exm.qua.ir.tree.IRInstructions.ResetPhase;
import exm.qua.ir.tree.IRInstructions.Save;
import exm.qua.ir.tree.IRInstructions.SetDcOffset;
import exm.qua.ir.tree.IRInstructions.UpdateCorrection;
import exm.qua.ir.tree.IRInstructions.UpdateFrequency;
import exm.qua.ir.tree.IRInstructions.Wait;
import exm.qua.ir.tree.IRInstructions.WaitForTrigger;
import exm.qua.ir.tree.IRInstructions.ZRotation;
import exm.qua.ir.tree.Loops.ForEachStatement;
import exm.qua.ir.tree.Loops.ForStatement;
import exm.qua.ir.tree.Loops.StrictTiming;

/**
 * One method per statement kind.  Implementations decide themselves
 * whether and how to descend into nested blocks.
 */
public interface IRVisitor<T> {
  T visitPlay(Play play);
  T visitMeasure(Measure measure);
  T visitWait(Wait wait);
  T visitWaitForTrigger(WaitForTrigger wait);
  T visitAlign(Align align);
  T visitAssign(Assign assign);
  T visitSave(Save save);
  T visitPause(Pause pause);
  T visitUpdateFrequency(UpdateFrequency update);
  T visitUpdateCorrection(UpdateCorrection update);
  T visitSetDcOffset(SetDcOffset offset);
  T visitAdvanceInputStream(AdvanceInputStream advance);
  T visitResetPhase(ResetPhase reset);
  T visitResetFrame(ResetFrame reset);
  T visitRampToZero(RampToZero ramp);
  T visitZRotation(ZRotation rotation);
  T visitFastFrameRotation(FastFrameRotation rotation);

  T visitIf(IfStatement stmt);
  T visitFor(ForStatement loop);
  T visitForEach(ForEachStatement loop);
  T visitStrictTiming(StrictTiming block);
}
