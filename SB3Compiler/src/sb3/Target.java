package sb3;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.gson.JsonPrimitive;

@AutoValue
public abstract class Target {

  @AutoValue
  public abstract static class Variable {
    public abstract String id();

    public abstract String name();

    public abstract JsonPrimitive value();

    public static Variable create(String id, String name, JsonPrimitive value) {
      return new AutoValue_Target_Variable(id, name, value);
    }
  }

  @AutoValue
  public abstract static class ListVariable {
    public abstract String id();

    public abstract String name();

    public abstract ImmutableList<JsonPrimitive> contents();

    public static ListVariable create(String id, String name, Iterable<JsonPrimitive> contents) {
      return new AutoValue_Target_ListVariable(id, name, ImmutableList.copyOf(contents));
    }
  }

  public abstract String name();

  public abstract boolean isStage();

  public abstract BlockGraph blocks();

  public abstract ImmutableMap<String, Variable> variables();

  public abstract ImmutableMap<String, ListVariable> lists();

  // Broadcast id to message name.
  public abstract ImmutableMap<String, String> broadcasts();

  public abstract ImmutableList<CustomProcedure> procedures();

  public abstract ImmutableSet<String> referencedSounds();

  public abstract ImmutableList<Asset.Costume> costumes();

  public abstract ImmutableList<Asset.Sound> sounds();

  public abstract int currentCostume();

  public abstract double volume();

  public abstract int layerOrder();

  // Sprite state.

  public abstract boolean visible();

  public abstract double x();

  public abstract double y();

  public abstract double size();

  public abstract double direction();

  public abstract boolean draggable();

  public abstract String rotationStyle();

  // Stage state.

  public abstract double tempo();

  public abstract double videoTransparency();

  public abstract String videoState();

  public abstract Optional<String> textToSpeechLanguage();

  public Optional<Variable> variableNamed(String name) {
    return variables().values().stream().filter(v -> v.name().equals(name)).findFirst();
  }

  public Optional<ListVariable> listNamed(String name) {
    return lists().values().stream().filter(l -> l.name().equals(name)).findFirst();
  }

  public Optional<CustomProcedure> procedureByProccode(String proccode) {
    return procedures().stream().filter(p -> p.proccode().equals(proccode)).findFirst();
  }

  public abstract Builder toBuilder();

  public static Builder spriteBuilder(String name) {
    return defaults().setName(name).setIsStage(false);
  }

  public static Builder stageBuilder(String name) {
    return defaults().setName(name).setIsStage(true);
  }

  private static Builder defaults() {
    return new AutoValue_Target.Builder()
        .setBlocks(BlockGraph.empty())
        .setCostumes(ImmutableList.of())
        .setSounds(ImmutableList.of())
        .setCurrentCostume(0)
        .setVolume(100)
        .setLayerOrder(0)
        .setVisible(true)
        .setX(0)
        .setY(0)
        .setSize(100)
        .setDirection(90)
        .setDraggable(false)
        .setRotationStyle("all around")
        .setTempo(60)
        .setVideoTransparency(50)
        .setVideoState("on");
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setName(String name);

    public abstract Builder setIsStage(boolean isStage);

    public abstract Builder setBlocks(BlockGraph blocks);

    public abstract ImmutableMap.Builder<String, Variable> variablesBuilder();

    public Builder addVariable(Variable variable) {
      variablesBuilder().put(variable.id(), variable);
      return this;
    }

    public abstract ImmutableMap.Builder<String, ListVariable> listsBuilder();

    public Builder addList(ListVariable list) {
      listsBuilder().put(list.id(), list);
      return this;
    }

    public abstract ImmutableMap.Builder<String, String> broadcastsBuilder();

    public abstract ImmutableList.Builder<CustomProcedure> proceduresBuilder();

    public abstract ImmutableSet.Builder<String> referencedSoundsBuilder();

    public abstract Builder setCostumes(ImmutableList<Asset.Costume> costumes);

    public abstract Builder setSounds(ImmutableList<Asset.Sound> sounds);

    public abstract Builder setCurrentCostume(int currentCostume);

    public abstract Builder setVolume(double volume);

    public abstract Builder setLayerOrder(int layerOrder);

    public abstract Builder setVisible(boolean visible);

    public abstract Builder setX(double x);

    public abstract Builder setY(double y);

    public abstract Builder setSize(double size);

    public abstract Builder setDirection(double direction);

    public abstract Builder setDraggable(boolean draggable);

    public abstract Builder setRotationStyle(String rotationStyle);

    public abstract Builder setTempo(double tempo);

    public abstract Builder setVideoTransparency(double videoTransparency);

    public abstract Builder setVideoState(String videoState);

    public abstract Builder setTextToSpeechLanguage(Optional<String> textToSpeechLanguage);

    public abstract Target build();
  }
}
