package com.lambdacalc.cli;

import com.lambdacalc.runtime.PrimitiveTable;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

/**
 * picocli defs 子命令：列出原语定义
 */
@Command(name = "defs", description = "列出 δ 归约使用的原语定义")
public class DefsCommand implements Runnable {

    @ParentCommand
    Main parent;

    @Override
    public void run() {
        ReplRunner.printDefinitions(PrimitiveTable.standard(), parent.out);
    }
}
